// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.exception;

/// A value did not match the type it was checked against, either while decoding arguments from a
/// request or while encoding a return value for a response.
public class CodecException extends FatalException {

    private final String path;

    public CodecException (String path, String message) {
        super(message);
        this.path = path;
    }

    /// Dotted location of the offending value, such as "getUser.args.id".
    public String path () {
        return path;
    }

}
