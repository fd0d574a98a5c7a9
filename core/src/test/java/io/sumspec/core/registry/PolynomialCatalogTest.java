// file: core/src/test/java/io/sumspec/core/registry/PolynomialCatalogTest.java
package io.sumspec.core.registry;

import io.sumspec.core.expr.PolyKind;
import io.sumspec.core.json.CatalogLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolynomialCatalogTest {

    @Test
    void reference_catalog_lists_polynomials_and_parameters() {
        var catalog = CatalogLoader.reference();
        assertEquals(73, catalog.entries().size());
        assertEquals(13, catalog.parameters().size());
        assertEquals("T", catalog.parameters().get(0).symbol());
        assertEquals("trace_length", catalog.parameters().get(0).codeName());
    }

    @Test
    void same_name_may_be_catalogued_under_two_kinds() {
        var catalog = CatalogLoader.reference();
        assertTrue(catalog.lookup("InstructionRa(i)", PolyKind.COMMITTED).isPresent());
        assertTrue(catalog.lookup("InstructionRa(i)", PolyKind.VIRTUAL).isPresent());
        assertTrue(catalog.lookup("InstructionRa(i)", PolyKind.VERIFIER).isEmpty());
    }

    @Test
    void entries_carry_domain_and_category() {
        var rdInc = CatalogLoader.reference().lookup("RdInc", PolyKind.COMMITTED).orElseThrow();
        assertEquals("Registers", rdInc.category());
        assertEquals(1, rdInc.domain().size());
        assertEquals("log2(T)", rdInc.domain().get(0).logSize());
    }

    @Test
    void duplicate_name_and_kind_is_rejected() {
        var e = new CatalogEntry("A", PolyKind.VIRTUAL, "", "", List.of());
        assertThrows(IllegalArgumentException.class, () -> new PolynomialCatalog(List.of(e, e), List.of()));
        assertTrue(PolynomialCatalog.empty().entries().isEmpty());
    }
}
