package io.genxdata.engine.generator;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link ColumnGenerator} implementation with the strategy it provides.
 *
 * <p>{@link GeneratorRegistry} reads this annotation from the service providers it
 * discovers, without instantiating them.
 *
 * <pre>{@code
 * @AutoService(ColumnGenerator.class)
 * @GeneratorKind(StrategyKind.SERIES)
 * @ParamsType(SeriesParams.class)
 * public class SeriesGenerator extends AbstractColumnGenerator<SeriesParams> {
 *     // ...
 * }
 * }</pre>
 *
 * @see ParamsType
 * @see GeneratorRegistry
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface GeneratorKind {
    StrategyKind value();
}
