// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.protocol;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/// Side-channel values that travel with a request outside its arguments. Each protocol version
/// has its own variant, so the fields a version defines are typed, while values() offers the same
/// information as a plain key/value bag for hooks that don't care which version was used.
public interface RequestExtra {

    /// A fresh copy of the values, safe to modify.
    ObjectNode values ();

    /// Version 1 requests carry no extra values.
    record None () implements RequestExtra {
        @Override
        public ObjectNode values () {
            return JsonNodeFactory.instance.objectNode();
        }
    }

    /// Version 2 identifies the partner integration and the client session. Either may be null.
    record Session (String partnerId, String sessionId) implements RequestExtra {
        @Override
        public ObjectNode values () {
            ObjectNode values = JsonNodeFactory.instance.objectNode();
            values.put("partnerId", partnerId);
            values.put("sessionId", sessionId);
            return values;
        }
    }

    /// Version 3 lets clients send any object.
    record Open (ObjectNode extra) implements RequestExtra {
        public Open {
            extra = extra.deepCopy();
        }

        @Override
        public ObjectNode values () {
            return extra.deepCopy();
        }
    }

}
