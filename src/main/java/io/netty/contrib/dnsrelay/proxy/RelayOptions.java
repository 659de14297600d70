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

/**
 * Per-call preferences for the protocol used towards the upstream server.
 * <p>
 * {@link #forceTcp()} wins over {@link #preferUdp()}; without either the protocol the client used is
 * kept. An upstream address with a {@code tls://} scheme overrides all of them.
 */
public final class RelayOptions {

    public static final RelayOptions DEFAULT = new RelayOptions(false, false);

    private final boolean forceTcp;
    private final boolean preferUdp;

    private RelayOptions(boolean forceTcp, boolean preferUdp) {
        this.forceTcp = forceTcp;
        this.preferUdp = preferUdp;
    }

    public static RelayOptions of(boolean forceTcp, boolean preferUdp) {
        if (!forceTcp && !preferUdp) {
            return DEFAULT;
        }
        return new RelayOptions(forceTcp, preferUdp);
    }

    public boolean forceTcp() {
        return forceTcp;
    }

    public boolean preferUdp() {
        return preferUdp;
    }

    public RelayOptions withForceTcp(boolean forceTcp) {
        return of(forceTcp, preferUdp);
    }

    public RelayOptions withPreferUdp(boolean preferUdp) {
        return of(forceTcp, preferUdp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RelayOptions)) {
            return false;
        }
        RelayOptions that = (RelayOptions) o;
        return forceTcp == that.forceTcp && preferUdp == that.preferUdp;
    }

    @Override
    public int hashCode() {
        return (forceTcp ? 2 : 0) | (preferUdp ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RelayOptions(forceTcp: " + forceTcp + ", preferUdp: " + preferUdp + ')';
    }
}
