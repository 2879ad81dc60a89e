// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/// Description of the client device making a call. Every field except id may be null when the
/// client did not report it; which defaults apply depends on the protocol version.
/// The platform is free-form JSON: older clients send a string, current ones an object.
public record DeviceInfo (String id, String language, JsonNode platform, String timezone, String type, String version) { }
