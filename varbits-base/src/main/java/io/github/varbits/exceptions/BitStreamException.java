/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.varbits.exceptions;

import java.io.IOException;

/**
 * Unchecked exception raised by bit-level read, write and conversion operations.
 * <p>
 * The failure kind is exposed through {@link #getErrorType()} so that callers can distinguish a
 * graceful end of data from a caller bug or a failing medium without parsing messages.
 */
public class BitStreamException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * The kinds of failure a bit codec operation can report.
     */
    public enum ErrorType {
        /** The underlying byte medium reported a failure. */
        IO,
        /** The requested bit count is outside the valid range for the operation. */
        INVALID_BIT_COUNT,
        /** Fewer bits remain than were requested. */
        END_OF_STREAM,
        /** A value cannot be represented in the requested integer type. */
        INVALID_CONVERSION
    }

    private final ErrorType errorType;

    /**
     * Constructs a new exception of the given type.
     *
     * @param errorType the kind of failure
     * @param message the detail message
     */
    public BitStreamException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    /**
     * Constructs a new exception of the given type with a cause.
     *
     * @param errorType the kind of failure
     * @param message the detail message
     * @param cause the underlying failure
     */
    public BitStreamException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    /**
     * @return the kind of failure this exception reports
     */
    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Creates an exception for a bit count outside {@code [1, maxBits]}.
     *
     * @param requested the rejected bit count
     * @param maxBits the largest bit count the operation accepts
     * @return a new exception of type {@link ErrorType#INVALID_BIT_COUNT}
     */
    public static BitStreamException invalidBitCount(int requested, int maxBits) {
        return new BitStreamException(ErrorType.INVALID_BIT_COUNT,
                String.format("Invalid bit count %d, must be between 1 and %d", requested, maxBits));
    }

    /**
     * @return a new exception of type {@link ErrorType#END_OF_STREAM}
     */
    public static BitStreamException endOfStream() {
        return new BitStreamException(ErrorType.END_OF_STREAM, "End of stream reached while reading");
    }

    /**
     * Wraps a failure of the underlying byte medium.
     *
     * @param cause the I/O failure
     * @return a new exception of type {@link ErrorType#IO} with {@code cause} attached
     */
    public static BitStreamException io(IOException cause) {
        return new BitStreamException(ErrorType.IO, "An I/O error occurred: " + cause.getMessage(), cause);
    }

    /**
     * @param message describes the value and the requested target type
     * @return a new exception of type {@link ErrorType#INVALID_CONVERSION}
     */
    public static BitStreamException invalidConversion(String message) {
        return new BitStreamException(ErrorType.INVALID_CONVERSION, message);
    }
}
