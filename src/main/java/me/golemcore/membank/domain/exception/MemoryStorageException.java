package me.golemcore.membank.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * The durable store rejected or failed a read or write. Retryable by the
 * caller; the operation that raised it did not report success.
 */
public class MemoryStorageException extends MemoryBankException {

    public MemoryStorageException(String message) {
        super(message);
    }

    public MemoryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
