// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This is the data model for the HTTP API: the response envelopes of each protocol generation
/// and the small documents served on the non-RPC endpoints. These are message types that are only
/// ever serialized to JSON on the wire.
package io.pfive.rpcgate.http.model;
