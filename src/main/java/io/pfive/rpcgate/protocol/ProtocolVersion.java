// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import io.pfive.rpcgate.util.Ret;

/// The generations of the request and response format, oldest first.
public enum ProtocolVersion {
    /// Oldest format: id, name, args and a device object.
    V1(1),
    /// Adds requestId, deviceId, an info object and session/partner identifiers.
    V2(2),
    /// Current format: name, args, optional requestId, deviceInfo and an open extra object.
    V3(3);

    public final int number;

    ProtocolVersion (int number) {
        this.number = number;
    }

    public static Ret<ProtocolVersion> fromNumber (int number) {
        for (ProtocolVersion version : values()) {
            if (version.number == number) return Ret.ok(version);
        }
        return Ret.err("Unknown request version " + number);
    }
}
