package villagecompute.weatherboard.services;

import io.quarkus.elytron.security.common.BcryptUtil;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.weatherboard.BaseIntegrationTest;
import villagecompute.weatherboard.TestConstants;
import villagecompute.weatherboard.TestFixtures;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.data.models.UserCity;
import villagecompute.weatherboard.exceptions.DuplicateResourceException;
import villagecompute.weatherboard.exceptions.ValidationException;
import villagecompute.weatherboard.testing.H2TestResource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for registration and password authentication in {@link AuthIdentityService}.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class AccountRegistrationTest extends BaseIntegrationTest {

    @Inject
    AuthIdentityService authService;

    @BeforeEach
    @Transactional
    void cleanDatabase() {
        UserCity.deleteAll();
        User.deleteAll();
    }

    @Test
    @Transactional
    void testRegister_hashesPasswordAndNormalizesEmail() {
        User user = authService.register("  Ada  ", "  Ada@Example.COM ", TestConstants.VALID_PASSWORD);

        assertEntityExists(User.class, user.id);
        assertEquals("Ada", user.username);
        assertEquals("ada@example.com", user.email);
        assertTrue(user.passwordHash.startsWith("$2"));
        assertTrue(BcryptUtil.matches(TestConstants.VALID_PASSWORD, user.passwordHash));
        assertNull(user.oauthProvider);
        assertNotNull(user.createdAt);
    }

    @Test
    @Transactional
    void testRegister_duplicateEmailIgnoresCase() {
        TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);

        assertThrows(DuplicateResourceException.class,
                () -> authService.register("Other", "TEST@example.com", TestConstants.VALID_PASSWORD));
    }

    @Test
    void testRegister_blankFieldsRejected() {
        assertThrows(ValidationException.class, () -> authService.register(" ", TestConstants.VALID_EMAIL, "pw"));
        assertThrows(ValidationException.class, () -> authService.register("Name", null, "pw"));
        assertThrows(ValidationException.class, () -> authService.register("Name", TestConstants.VALID_EMAIL, ""));
    }

    @Test
    @Transactional
    void testAuthenticate() {
        User user = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);

        assertEquals(user.id, authService.authenticate(TestConstants.VALID_EMAIL, TestConstants.VALID_PASSWORD)
                .orElseThrow().id);
        assertTrue(authService.authenticate(TestConstants.VALID_EMAIL, "wrong-password").isEmpty());
        assertTrue(authService.authenticate("nobody@example.com", TestConstants.VALID_PASSWORD).isEmpty());
        assertTrue(authService.authenticate(TestConstants.VALID_EMAIL, null).isEmpty());
    }

    @Test
    @Transactional
    void testAuthenticate_providerAccountHasNoPassword() {
        TestFixtures.createGoogleUser(TestConstants.VALID_EMAIL_2, TestConstants.OAUTH_GOOGLE_SUBJECT);

        assertTrue(authService.authenticate(TestConstants.VALID_EMAIL_2, TestConstants.VALID_PASSWORD).isEmpty());
    }
}
