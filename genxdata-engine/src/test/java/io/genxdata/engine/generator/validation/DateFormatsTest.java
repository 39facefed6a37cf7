package io.genxdata.engine.generator.validation;

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

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DateFormatsTest {

    @Test
    public void testTranslation() {
        assertThat(DateFormats.translate("%Y-%m-%d", false)).isEqualTo("yyyy'-'MM'-'dd");
        assertThat(DateFormats.translate("%Y-%m-%d", true)).isEqualTo("yyyy'-'M'-'d");
        assertThat(DateFormats.translate("%Y%m%d", true)).isEqualTo("yyyyMMdd");
        assertThat(DateFormats.translate("yyyy-MM-dd", true)).isEqualTo("yyyy-MM-dd");
        assertThat(DateFormats.translate("100%% at %H", false)).isEqualTo("'100% at 'HH");
    }

    @Test
    public void testParsesUnpaddedValues() {
        assertThat(DateFormats.parseDateTime("2020-1-5", "%Y-%m-%d")).isEqualTo(LocalDateTime.of(2020, 1, 5, 0, 0));
        assertThat(DateFormats.parseDateTime("20200105", "%Y%m%d")).isEqualTo(LocalDateTime.of(2020, 1, 5, 0, 0));
    }

    @Test
    public void testTimeOnlyDefaultsDate() {
        assertThat(DateFormats.parseDateTime("7:05", "%H:%M")).isEqualTo(LocalDateTime.of(1900, 1, 1, 7, 5));
    }

    @Test
    public void testFormatting() {
        LocalDateTime value = LocalDateTime.of(2024, 3, 9, 14, 5, 7);
        assertThat(DateFormats.format(value, "%d/%m/%Y %H:%M:%S")).isEqualTo("09/03/2024 14:05:07");
        assertThat(DateFormats.format(value, "%b %d, %Y")).isEqualTo("Mar 09, 2024");
        assertThat(DateFormats.format(value, "%I %p")).isEqualTo("02 PM");
    }

    @Test
    public void testUnsupportedDirective() {
        assertThatThrownBy(() -> DateFormats.printer("%Q")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DateFormats.printer("%Y%")).isInstanceOf(IllegalArgumentException.class);
    }
}
