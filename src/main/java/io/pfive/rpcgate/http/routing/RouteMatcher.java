// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.routing;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Decides whether a route applies to a request path. An exact matcher accepts one path string;
/// a pattern matcher accepts any path where the regular expression matches starting at index 0.
public interface RouteMatcher {

    /// @return the number of characters of the path matched, or -1 if the path is not accepted.
    int matchLength (String path);

    boolean isExact ();

    static RouteMatcher exact (String path) {
        return new Exact(path);
    }

    static RouteMatcher pattern (String regex) {
        return new Prefix(Pattern.compile(regex));
    }

    record Exact (String path) implements RouteMatcher {
        @Override
        public int matchLength (String candidate) {
            return path.equals(candidate) ? candidate.length() : -1;
        }

        @Override
        public boolean isExact () {
            return true;
        }
    }

    record Prefix (Pattern pattern) implements RouteMatcher {
        @Override
        public int matchLength (String candidate) {
            Matcher matcher = pattern.matcher(candidate);
            return matcher.lookingAt() ? matcher.end() : -1;
        }

        @Override
        public boolean isExact () {
            return false;
        }
    }

}
