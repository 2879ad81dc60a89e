// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.rpcgate.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetTest {

    @Test
    void mapCarriesErrorsThrough () {
        Ret<Integer> length = Ret.<String>err("nothing here").map(String::length);
        assertTrue(length.isErr());
        assertEquals("nothing here", length.errorMessage());
        assertEquals(5, Ret.ok("hello").map(String::length).get());
    }

    @Test
    void getOrThrowUsesSuppliedException () {
        Ret<String> ret = Ret.err("bad version");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ret.getOrThrow(IllegalArgumentException::new));
        assertEquals("bad version", e.getMessage());
        assertThrows(MissingReturnValueException.class, ret::get);
    }

    @Test
    void okHasNoErrorMessage () {
        assertThrows(IllegalStateException.class, () -> Ret.ok(1).errorMessage());
        assertThrows(IllegalArgumentException.class, () -> Ret.ok(null));
    }

}
