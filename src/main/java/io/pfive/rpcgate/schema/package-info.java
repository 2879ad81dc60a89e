// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// The compiled interface description ("AST") consumed read-only by the gateway, and the codec
/// that checks JSON values against the types it declares. The description is produced by an
/// external compiler; this package only reads it.
package io.pfive.rpcgate.schema;
