package io.genxdata.engine.generator.strategies;

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

import com.google.auto.service.AutoService;
import io.genxdata.engine.generator.AbstractColumnGenerator;
import io.genxdata.engine.generator.ColumnGenerator;
import io.genxdata.engine.generator.GeneratorKind;
import io.genxdata.engine.generator.ParamsType;
import io.genxdata.engine.generator.StrategyKind;
import io.genxdata.engine.generator.params.DeleteParams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Nulls out the targeted rows.
@AutoService(ColumnGenerator.class)
@GeneratorKind(StrategyKind.DELETE)
@ParamsType(DeleteParams.class)
public class DeleteGenerator extends AbstractColumnGenerator<DeleteParams> {

    @Override
    public List<Object> generateChunk(int count) {
        return new ArrayList<>(Collections.nCopies(count, null));
    }

    @Override
    public boolean honorsUniqueness() {
        return false;
    }
}
