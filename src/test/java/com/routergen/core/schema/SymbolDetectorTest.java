package com.routergen.core.schema;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolDetectorTest {

    @Test
    void testDetectsLiteralSymbols() {
        assertTrue(SymbolDetector.namesLiteralSymbol("where is authenticate() defined"));
        assertTrue(SymbolDetector.namesLiteralSymbol("find usages of getUserById"));
        assertTrue(SymbolDetector.namesLiteralSymbol("where is PaymentGateway wired into checkout"));
        assertTrue(SymbolDetector.namesLiteralSymbol("who reads MAX_RETRY_COUNT"));
        assertTrue(SymbolDetector.namesLiteralSymbol("grep for parse_config please"));
        assertTrue(SymbolDetector.namesLiteralSymbol("look at `billing` usage"));
        assertTrue(SymbolDetector.namesLiteralSymbol("show me class User"));
    }

    @Test
    void testConceptQueriesHaveNoSymbol() {
        assertFalse(SymbolDetector.namesLiteralSymbol("find where authentication tokens are validated"));
        assertFalse(SymbolDetector.namesLiteralSymbol("how does the payment retry logic work"));
        assertFalse(SymbolDetector.namesLiteralSymbol("find the function that validates user input"));
        assertFalse(SymbolDetector.namesLiteralSymbol(""));
        assertFalse(SymbolDetector.namesLiteralSymbol(null));
    }

    @Test
    void testFindSymbolReturnsMatch() {
        assertEquals("refreshSession(", SymbolDetector.findSymbol("why does refreshSession() leak").orElseThrow());
    }
}
