// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Execution of a single call: finding its implementation, running the hooks around it, checking
/// its arguments and result against the interface description, and restricting the error types it
/// may report to the ones it declares.
package io.pfive.rpcgate.dispatch;
