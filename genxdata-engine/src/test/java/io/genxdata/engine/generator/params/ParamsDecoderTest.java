package io.genxdata.engine.generator.params;

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

import io.genxdata.engine.errors.InvalidConfigParamException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParamsDecoderTest {

    @Test
    public void testDefaultsAreApplied() {
        DecodedParams decoded = ParamsDecoder.decode("RANDOM_NUMBER_RANGE_STRATEGY", RandomNumberRangeParams.class, null);
        RandomNumberRangeParams params = (RandomNumberRangeParams) decoded.params();
        assertThat(params.start()).isEqualTo(0);
        assertThat(params.end()).isEqualTo(99);
        assertThat(params.step()).isEqualTo(1);
        assertThat(params.precision()).isZero();
        assertThat(params.unique()).isFalse();
        assertThat(decoded.normalized()).containsEntry("end", 99).containsEntry("precision", 0);
    }

    @Test
    public void testUnknownKeysAreKept() {
        DecodedParams decoded = ParamsDecoder.decode("SERIES_STRATEGY", SeriesParams.class,
            Map.of("start", 3, "seed", 42));
        assertThat(decoded.normalized()).containsEntry("start", 3).containsEntry("seed", 42).containsEntry("step", 1);
    }

    @Test
    public void testWrongTypeIsReported() {
        assertThatThrownBy(() -> ParamsDecoder.decode("SERIES_STRATEGY", SeriesParams.class, Map.of("start", "abc")))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageStartingWith("Invalid parameters for SERIES_STRATEGY");
    }

    @Test
    public void testNumericRangeValidation() {
        assertThatThrownBy(() -> ParamsDecoder.decode("RANDOM_NUMBER_RANGE_STRATEGY", RandomNumberRangeParams.class,
            Map.of("start", 10, "end", 10)))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageContaining("must be less than");
        assertThatThrownBy(() -> ParamsDecoder.decode("RANDOM_NUMBER_RANGE_STRATEGY", RandomNumberRangeParams.class,
            Map.of("step", 0)))
            .isInstanceOf(InvalidConfigParamException.class);
    }

    @Test
    public void testWeightsMustSumToHundred() {
        assertThatThrownBy(() -> ParamsDecoder.decode("DISTRIBUTED_CHOICE_STRATEGY", DistributedChoiceParams.class,
            Map.of("choices", Map.of("a", 40, "b", 40))))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageContaining("sum to 100");
        assertThatThrownBy(() -> ParamsDecoder.decode("DISTRIBUTED_NUMBER_RANGE_STRATEGY",
            DistributedNumberRangeParams.class,
            Map.of("ranges", List.of(Map.of("start", 1, "end", 2, "distribution", 120)))))
            .isInstanceOf(InvalidConfigParamException.class);
    }

    @Test
    public void testDateValidation() {
        assertThatThrownBy(() -> ParamsDecoder.decode("RANDOM_DATE_RANGE_STRATEGY", RandomDateRangeParams.class,
            Map.of("start_date", "2024-02-01", "end_date", "2024-01-01")))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageContaining("must be before");
        assertThatThrownBy(() -> ParamsDecoder.decode("RANDOM_DATE_RANGE_STRATEGY", RandomDateRangeParams.class,
            Map.of("start_date", "01/02/2024")))
            .isInstanceOf(InvalidConfigParamException.class);
        assertThatThrownBy(() -> ParamsDecoder.decode("DATE_SERIES_STRATEGY", DateSeriesParams.class,
            Map.of("freq", "3Q")))
            .isInstanceOf(InvalidConfigParamException.class)
            .hasMessageContaining("Unsupported frequency unit");
    }

    @Test
    public void testFrequencyParsing() {
        DateSeriesParams params = (DateSeriesParams) ParamsDecoder.decode("DATE_SERIES_STRATEGY",
            DateSeriesParams.class, Map.of("freq", "15min")).params();
        assertThat(params.frequency()).isEqualTo(new DateSeriesParams.Frequency(15, DateSeriesParams.Unit.MINUTE));
    }

    @Test
    public void testEnumeratedTextParams() {
        assertThatThrownBy(() -> ParamsDecoder.decode("RANDOM_NAME_STRATEGY", RandomNameParams.class,
            Map.of("name_type", "middle")))
            .isInstanceOf(InvalidConfigParamException.class);
        assertThatThrownBy(() -> ParamsDecoder.decode("UUID_STRATEGY", UuidParams.class, Map.of("version", 1)))
            .isInstanceOf(InvalidConfigParamException.class);
        assertThatThrownBy(() -> ParamsDecoder.decode("PATTERN_STRATEGY", PatternParams.class, Map.of("regex", "[a-")))
            .isInstanceOf(InvalidConfigParamException.class);
    }

    @Test
    public void testTimeRangeMayWrapButNotBeEmpty() {
        ParamsDecoder.decode("TIME_RANGE_STRATEGY", TimeRangeParams.class,
            Map.of("start_time", "22:00:00", "end_time", "06:00:00"));
        assertThatThrownBy(() -> ParamsDecoder.decode("TIME_RANGE_STRATEGY", TimeRangeParams.class,
            Map.of("start_time", "10:00:00", "end_time", "10:00:00")))
            .isInstanceOf(InvalidConfigParamException.class);
    }
}
