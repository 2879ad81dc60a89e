// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.http.routing;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.pfive.rpcgate.util.Ret;
import org.eclipse.jetty.server.Handler;

import java.util.ArrayList;
import java.util.List;

/// Ordered registry of handlers for the paths served next to the RPC endpoint, such as generated
/// sources, the interface description and the playground UI. Entries are only ever appended, and
/// only while the server is being assembled, so lookups need no locking.
///
/// Of all entries whose method equals the request method and whose matcher accepts the path:
/// an exact matcher always wins over a pattern; among patterns the one matching the most
/// characters wins; remaining ties go to the entry registered first. This lets a broad prefix
/// route coexist with more specific routes registered after it.
public class RouteTable {

    public record Entry (String method, RouteMatcher matcher, Handler handler) { }

    private final List<Entry> entries = new ArrayList<>();

    public void register (String method, RouteMatcher matcher, Handler handler) {
        Preconditions.checkNotNull(method);
        Preconditions.checkNotNull(matcher);
        Preconditions.checkNotNull(handler);
        entries.add(new Entry(method, matcher, handler));
    }

    public Ret<Entry> resolve (String method, String path) {
        Entry best = null;
        int bestLength = -1;
        for (Entry entry : entries) {
            if (!entry.method.equals(method)) continue;
            int length = entry.matcher.matchLength(path);
            if (length < 0) continue;
            if (best == null || outranks(entry, length, best, bestLength)) {
                best = entry;
                bestLength = length;
            }
        }
        if (best == null) {
            return Ret.err("No route for %s %s".formatted(method, path));
        }
        return Ret.ok(best);
    }

    private static boolean outranks (Entry candidate, int candidateLength, Entry best, int bestLength) {
        if (candidate.matcher.isExact()) {
            return !best.matcher.isExact();
        }
        if (best.matcher.isExact()) {
            return false;
        }
        return candidateLength > bestLength;
    }

    public ImmutableList<Entry> entries () {
        return ImmutableList.copyOf(entries);
    }

}
