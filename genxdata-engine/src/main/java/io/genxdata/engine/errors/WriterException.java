package io.genxdata.engine.errors;

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

/// Raised by sinks when generated data cannot be written.
public class WriterException extends GenXDataException {

    public WriterException(String message) {
        super(ErrorCategory.IO, ErrorCategory.IO.code(1), message);
    }

    public WriterException(String message, Throwable cause) {
        super(ErrorCategory.IO, ErrorCategory.IO.code(1), message, cause);
    }
}
