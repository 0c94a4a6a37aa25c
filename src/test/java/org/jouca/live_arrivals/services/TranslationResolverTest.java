package org.jouca.live_arrivals.services;

import org.jouca.live_arrivals.cache.TtlCache;
import org.jouca.live_arrivals.finders.SqliteScheduleStore;
import org.jouca.live_arrivals.finders.ScheduleFixture;
import org.jouca.live_arrivals.records.Address;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TranslationResolver class.
 * 
 * Tests translation lookups, city names and address translation.
 */
class TranslationResolverTest {

    @TempDir
    Path tempDir;

    private SqliteScheduleStore store;
    private TranslationResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        store = ScheduleFixture.open(tempDir);
        resolver = new TranslationResolver(store, new AddressParser(),
            new TtlCache<String, Map<String, String>>("translations", Duration.ofMinutes(5)),
            new TtlCache<String, Optional<String>>("cities", Duration.ofMinutes(5)));
    }

    @AfterEach
    void tearDown() throws Exception {
        store.close();
    }

    @Test
    void testTranslateAllLanguages() {
        Map<String, String> names = resolver.translate("תחנה א");

        assertEquals(2, names.size());
        assertEquals("Station A", names.get("EN"));
        assertEquals("محطة أ", names.get("AR"));
    }

    @Test
    void testUntranslatedStringIsReturnedInSourceLanguage() {
        assertEquals(Map.of("HE", "רחוב \"הגפן\""), resolver.translate("רחוב ''הגפן''"));
        assertNull(resolver.translate(null));
    }

    @Test
    void testTranslateMatchesBothQuoteSpellings() {
        assertEquals("Tel Aviv", resolver.translate("ת''א", "EN"));
        assertEquals("Tel Aviv", resolver.translate("ת\"א", "EN"));
        assertNull(resolver.translate("ת''א", "AR"));
    }

    @Test
    void testTranslateCity() {
        // Translation table first, then the city list
        assertEquals("Holon", resolver.translateCity("חולון"));
        assertEquals("TEL AVIV - YAFO", resolver.translateCity("תל אביב יפו"));
        assertNull(resolver.translateCity("nowhere"));
        assertNull(resolver.translateCity(""));
    }

    @Test
    void testTranslatedAddress() {
        Address address = resolver.translatedAddress(store.findStopByCode("21471"));

        assertEquals(new Address("יפו 2", "TEL AVIV - YAFO", "3", "1"), address);
        assertTrue(resolver.translatedAddress(store.findStopByCode("21472")).isEmpty());
    }

    @Test
    void testNormalizeQuotes() {
        assertEquals("ת\"א", TranslationResolver.normalizeQuotes("ת''א"));
    }
}
