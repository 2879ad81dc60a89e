// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import java.util.function.Function;

/// The return value of an operation, containing either a result or an error message.
///
/// Lookups in the gateway (a call in the interface description, a route for a path, a protocol
/// version number, the client address of a connection) can fail in ways that are part of normal
/// operation. Returning a Ret lets the caller decide whether absence means "fall through to the
/// next option" or "abort the request", and at the HTTP boundary getOrThrow() converts the error
/// into the exception type that fits the context.
///
/// Ok and Err are subclasses of abstract Ret so neither carries an always-empty field.
public abstract class Ret<T> {

    public boolean isErr () {
        return false;
    }

    public boolean isOk () {
        return false;
    }

    /// If the return value is Ok, returns the value. If it is an error, throw an exception.
    public final T get () {
        return getOrThrow(MissingReturnValueException::new);
    }

    public abstract T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory);

    /// Returns the error message. Will throw an exception if a return value is present instead of error.
    public abstract String errorMessage ();

    /// Transform the result if present, carrying any error through unchanged.
    public abstract <R> Ret<R> map (Function<? super T, ? extends R> function);

    // Factory methods allow static imports: return ok(x); or return err("Description");

    public static <T> Ret<T> ok (T result) {
        return new Ok<>(result);
    }

    public static <T> Ret<T> err (String message) {
        return new Err<>(message);
    }

    /// An Ok or Err instance should never wrap a null reference.
    private static void checkNotNull (Object o) {
        if (o == null) {
            throw new IllegalArgumentException("Supplied result or error must not be null.");
        }
    }

    // Java already defines an Error type, so the failure variant is named Err.

    public static final class Err<T> extends Ret<T> {
        public final String message; // Cannot be null.

        public Err (String message) {
            checkNotNull(message);
            this.message = message;
        }

        @Override
        public boolean isErr () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory) {
            throw exceptionFactory.apply(message);
        }

        @Override
        public String errorMessage () {
            return message;
        }

        @Override
        public <R> Ret<R> map (Function<? super T, ? extends R> function) {
            return new Err<>(message);
        }

        @Override
        public String toString () {
            return "Err<%s>".formatted(message);
        }
    }

    public static final class Ok<T> extends Ret<T> {
        public final T result; // Cannot be null.

        public Ok (T result) {
            checkNotNull(result);
            this.result = result;
        }

        @Override
        public boolean isOk () {
            return true;
        }

        @Override
        public T getOrThrow (Function<String, ? extends RuntimeException> exceptionFactory) {
            return result;
        }

        @Override
        public String errorMessage () {
            throw new IllegalStateException("This is not an error, so has no error message.");
        }

        @Override
        public <R> Ret<R> map (Function<? super T, ? extends R> function) {
            return new Ok<>(function.apply(result));
        }

        @Override
        public String toString () {
            return "Ok<%s>".formatted(result.toString());
        }
    }

}
