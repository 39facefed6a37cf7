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

import io.genxdata.engine.errors.UnsupportedStrategyException;
import io.genxdata.engine.generator.params.StrategyParams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Discovers {@link ColumnGenerator} implementations via SPI.
 *
 * <p>Providers are registered with {@code @AutoService(ColumnGenerator.class)} and carry
 * {@link GeneratorKind} and {@link ParamsType} annotations, which are read from the
 * provider type without instantiating it.
 *
 * <pre>{@code
 * Registration registration = GeneratorRegistry.resolve("SERIES_STRATEGY");
 * ColumnGenerator<?> generator = registration.newInstance();
 * }</pre>
 */
public final class GeneratorRegistry {

    @SuppressWarnings("rawtypes")
    private static final ServiceLoader<ColumnGenerator> serviceLoader =
        ServiceLoader.load(ColumnGenerator.class);

    private static Map<StrategyKind, Registration> registrations;

    /**
     * A discovered generator provider.
     *
     * @param kind the strategy kind it implements
     * @param type the implementation class
     * @param paramsType the parameter record it is initialized with
     */
    @SuppressWarnings("rawtypes")
    public record Registration(
        StrategyKind kind,
        Class<? extends ColumnGenerator> type,
        Class<? extends StrategyParams> paramsType,
        ServiceLoader.Provider<ColumnGenerator> provider
    ) {
        /// @return a new, uninitialized generator
        public ColumnGenerator<?> newInstance() {
            return provider.get();
        }
    }

    private GeneratorRegistry() {
    }

    /**
     * Resolves a strategy name or alias.
     *
     * @throws UnsupportedStrategyException if no generator provides the named strategy
     */
    public static Registration resolve(String strategyName) {
        StrategyKind kind = StrategyKind.fromName(strategyName)
            .orElseThrow(() -> new UnsupportedStrategyException(strategyName));
        return find(kind).orElseThrow(() -> new UnsupportedStrategyException(strategyName));
    }

    public static Optional<Registration> find(StrategyKind kind) {
        return Optional.ofNullable(registrations().get(kind));
    }

    public static boolean isAvailable(String strategyName) {
        return StrategyKind.fromName(strategyName).flatMap(GeneratorRegistry::find).isPresent();
    }

    /// @return configuration names of every registered strategy, in declaration order
    public static List<String> getAvailableNames() {
        return registrations().keySet().stream().map(StrategyKind::strategyName).collect(Collectors.toList());
    }

    public static List<Registration> getAll() {
        return new ArrayList<>(registrations().values());
    }

    /// Reloads the service loader to pick up newly available generators.
    public static synchronized void reload() {
        serviceLoader.reload();
        registrations = null;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static synchronized Map<StrategyKind, Registration> registrations() {
        if (registrations == null) {
            Map<StrategyKind, Registration> found = new EnumMap<>(StrategyKind.class);
            for (ServiceLoader.Provider<ColumnGenerator> provider : serviceLoader.stream().collect(Collectors.toList())) {
                Class<? extends ColumnGenerator> type = provider.type();
                GeneratorKind kind = type.getAnnotation(GeneratorKind.class);
                ParamsType paramsType = type.getAnnotation(ParamsType.class);
                if (kind == null || paramsType == null) {
                    throw new IllegalStateException("Column generator " + type.getName()
                        + " must be annotated with @GeneratorKind and @ParamsType");
                }
                Registration previous = found.putIfAbsent(kind.value(),
                    new Registration(kind.value(), type, paramsType.value(), provider));
                if (previous != null) {
                    throw new IllegalStateException("Strategy " + kind.value() + " is provided by both "
                        + previous.type().getName() + " and " + type.getName());
                }
            }
            registrations = Collections.unmodifiableMap(found);
        }
        return registrations;
    }
}
