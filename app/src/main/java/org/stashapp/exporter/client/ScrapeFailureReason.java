/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stashapp.exporter.client;

import java.util.Locale;

/**
 * Why a scrape of the Stash API failed.
 */
public enum ScrapeFailureReason {
    /** The request did not complete within the request timeout. */
    TIMEOUT,
    /** Connection refused, unknown host or another I/O failure. */
    TRANSPORT,
    /** Stash answered with a non-2xx HTTP status. */
    HTTP_STATUS,
    /** Stash answered 2xx but the body carries GraphQL errors. */
    GRAPHQL_ERROR,
    /** The body is not JSON or lacks an expected field. */
    MALFORMED_PAYLOAD,
    /** Anything not classified above. */
    UNEXPECTED;

    /**
     * @return Lower-case value used as a metric tag
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
