package me.golemcore.botmesh.port.outbound;

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

import java.util.Map;

/**
 * Outbound HTTP calls made by webhook tools.
 */
public interface WebhookPort {

    /**
     * Calls {@code url}. The body is sent as JSON unless the method is GET.
     *
     * @return status and body; the body is parsed JSON when possible, raw text
     *         otherwise
     */
    WebhookResponse call(String url, String method, Map<String, String> headers, Map<String, Object> body);

    record WebhookResponse(int status, Object body) {

        public boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }
}
