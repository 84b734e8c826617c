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

package me.golemcore.spoiler.adapter.inbound.telegram;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Watches the long polling client's {@code getUpdates} responses for HTTP 409.
 *
 * <p>
 * Telegram answers 409 when another client polls with the same token. After
 * {@code threshold} consecutive conflicts the monitor reports the channel as
 * conflicted until a poll succeeds again; the health endpoint then shows the
 * Telegram channel as not running.
 */
@Slf4j
public class PollingConflictMonitor implements Interceptor {

    private static final String GET_UPDATES = "getUpdates";
    private static final int HTTP_CONFLICT = 409;

    private final int threshold;
    private final AtomicInteger consecutiveConflicts = new AtomicInteger();
    private volatile boolean conflicted = false;

    public PollingConflictMonitor(int threshold) {
        this.threshold = Math.max(1, threshold);
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Response response = chain.proceed(chain.request());
        if (chain.request().url().encodedPath().endsWith(GET_UPDATES)) {
            record(response.code());
        }
        return response;
    }

    void record(int statusCode) {
        if (statusCode == HTTP_CONFLICT) {
            int conflicts = consecutiveConflicts.incrementAndGet();
            if (conflicted) {
                log.debug("[Telegram] Polling conflict ({} in a row)", conflicts);
            } else if (conflicts >= threshold) {
                conflicted = true;
                log.error("[Telegram] {} consecutive polling conflicts: another instance is polling with this "
                        + "bot token", conflicts);
            } else {
                log.warn("[Telegram] Polling conflict ({} in a row)", conflicts);
            }
        } else if (statusCode >= 200 && statusCode < 300) {
            consecutiveConflicts.set(0);
            if (conflicted) {
                conflicted = false;
                log.info("[Telegram] Polling recovered from conflict");
            }
        }
    }

    public boolean isConflicted() {
        return conflicted;
    }
}
