/*
 * Copyright 2024 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.contrib.dnsrelay.proxy;

import java.io.IOException;

/**
 * Signals that a connection taken from the idle cache turned out to be closed by the upstream.
 * Callers usually retry the query on a freshly dialed connection.
 */
public final class StaleConnectionException extends IOException {

    private static final long serialVersionUID = -2913840170612846523L;

    public StaleConnectionException(Throwable cause) {
        super("cached connection was closed by peer", cause);
    }
}
