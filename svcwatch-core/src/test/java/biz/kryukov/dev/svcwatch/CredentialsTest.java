package biz.kryukov.dev.svcwatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialsTest {

    @Test
    void toStringMasksSecrets() {
        String text = Credentials.of("admin", "hunter2", "k-42").toString();

        assertFalse(text.contains("admin"));
        assertFalse(text.contains("hunter2"));
        assertFalse(text.contains("k-42"));
    }

    @Test
    void blanksAreAbsent() {
        Credentials c = Credentials.of("", "", null);

        assertTrue(c.isEmpty());
        assertFalse(c.hasUsernamePassword());
        assertFalse(c.hasApiKey());
    }

    @Test
    void usernameWithoutPasswordIsIncomplete() {
        assertFalse(Credentials.of("admin", null, null).hasUsernamePassword());
        assertTrue(Credentials.ofPassword("admin", "pw").hasUsernamePassword());
    }
}
