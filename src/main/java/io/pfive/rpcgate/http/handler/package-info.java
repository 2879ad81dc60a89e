// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This package contains classes implementing the HTTP API as Jetty handlers.
/// Documentation on the Handler programming interface:
/// https://eclipse.dev/jetty/documentation/jetty-12/programming-guide/index.html#pg-server-http-handler-impl-request
package io.pfive.rpcgate.http.handler;
