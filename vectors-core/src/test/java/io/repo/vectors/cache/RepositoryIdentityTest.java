package io.repo.vectors.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryIdentityTest {

    @Test
    void testEquivalentLocatorsShareIdentity() {
        String identity = RepositoryIdentity.of("https://github.com/owner/repo");

        assertEquals(identity, RepositoryIdentity.of("https://github.com/owner/repo/"));
        assertEquals(identity, RepositoryIdentity.of("https://github.com/owner/repo.git"));
        assertEquals(identity, RepositoryIdentity.of("  https://github.com/owner/repo.git/ "));
    }

    @Test
    void testDistinctLocators() {
        assertNotEquals(RepositoryIdentity.of("https://github.com/owner/repo"),
            RepositoryIdentity.of("https://github.com/owner/other"));
    }

    @Test
    void testIdentityIsFileNameSafe() {
        String identity = RepositoryIdentity.of("C:\\work\\checkout");

        assertTrue(identity.matches("[0-9a-f]{64}"));
    }

    @Test
    void testNormalize() {
        assertEquals("/srv/repos/app", RepositoryIdentity.normalize("/srv/repos/app/"));
        assertEquals("/", RepositoryIdentity.normalize("/"));
    }

    @Test
    void testBlankLocatorRejected() {
        assertThrows(IllegalArgumentException.class, () -> RepositoryIdentity.of(" "));
    }
}
