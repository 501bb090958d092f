package villagecompute.weatherboard.api.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.elytron.security.common.BcryptUtil;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.response.Response;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.weatherboard.TestConstants;
import villagecompute.weatherboard.TestFixtures;
import villagecompute.weatherboard.data.models.OAuthState;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.data.models.UserCity;
import villagecompute.weatherboard.services.AuthIdentityService;
import villagecompute.weatherboard.testing.H2TestResource;

/**
 * Integration tests for {@link AuthResource}.
 *
 * Tests cover:
 * - Login page rendering and redirect of signed-in users
 * - Password login success and failure
 * - Registration, duplicate email and form validation
 * - Logout clearing the session cookie
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class AuthResourceTest {

    private static final String SESSION_COOKIE = "wb_session";
    private static final String FLASH_COOKIE = "wb_flash";

    @Inject
    AuthIdentityService authService;

    private User existingUser;

    @BeforeEach
    @Transactional
    public void setup() {
        UserCity.deleteAll();
        OAuthState.deleteAll();
        User.deleteAll();

        existingUser = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
    }

    @Test
    public void testLoginPage_rendersForm() {
        given().when().get("/").then().statusCode(200).contentType(containsString("text/html"))
                .body(containsString("Log in")).body(containsString("name=\"password\""));
    }

    @Test
    public void testLoginPage_signedInUserIsRedirected() {
        given().redirects().follow(false).cookie(SESSION_COOKIE, authService.createSessionToken(existingUser)).when()
                .get("/").then().statusCode(303).header("Location", endsWith("/weather"));
    }

    @Test
    public void testLogin_success() {
        Response response = given().redirects().follow(false).formParam("email", TestConstants.VALID_EMAIL)
                .formParam("password", TestConstants.VALID_PASSWORD).when().post("/");

        response.then().statusCode(303).header("Location", endsWith("/weather"));

        String token = response.getCookie(SESSION_COOKIE);
        assertNotNull(token);
        assertEquals(existingUser.id, authService.verifySessionToken(token).orElseThrow().userId());
        assertNotNull(response.getCookie(FLASH_COOKIE));
    }

    @Test
    public void testLogin_emailIsCaseInsensitive() {
        given().redirects().follow(false).formParam("email", "  TEST@Example.com ")
                .formParam("password", TestConstants.VALID_PASSWORD).when().post("/").then().statusCode(303)
                .header("Location", endsWith("/weather"));
    }

    @Test
    public void testLogin_wrongPassword() {
        Response response = given().redirects().follow(false).formParam("email", TestConstants.VALID_EMAIL)
                .formParam("password", "wrong-password").when().post("/");

        response.then().statusCode(200).body(containsString("Invalid email or password."));
        assertNull(response.getCookie(SESSION_COOKIE));
    }

    @Test
    public void testLogin_unknownEmail() {
        given().redirects().follow(false).formParam("email", "nobody@example.com")
                .formParam("password", TestConstants.VALID_PASSWORD).when().post("/").then().statusCode(200)
                .body(containsString("Invalid email or password."));
    }

    @Test
    public void testLogin_googleAccountHasNoPassword() {
        QuarkusTransaction.requiringNew().run(
                () -> TestFixtures.createGoogleUser(TestConstants.VALID_EMAIL_2, TestConstants.OAUTH_GOOGLE_SUBJECT));

        given().redirects().follow(false).formParam("email", TestConstants.VALID_EMAIL_2).formParam("password", "")
                .when().post("/").then().statusCode(400).body(containsString("Password is required."));
        given().redirects().follow(false).formParam("email", TestConstants.VALID_EMAIL_2)
                .formParam("password", TestConstants.VALID_PASSWORD).when().post("/").then().statusCode(200)
                .body(containsString("Invalid email or password."));
    }

    @Test
    public void testRegister_success() {
        Response response = given().redirects().follow(false).formParam("username", "New Person")
                .formParam("email", TestConstants.VALID_EMAIL_2).formParam("password", TestConstants.VALID_PASSWORD)
                .when().post("/register");

        response.then().statusCode(303).header("Location", endsWith("/weather"));
        assertNotNull(response.getCookie(SESSION_COOKIE));

        User created = QuarkusTransaction.requiringNew()
                .call(() -> User.findByEmail(TestConstants.VALID_EMAIL_2).orElseThrow());
        assertEquals("New Person", created.username);
        assertNotEquals(TestConstants.VALID_PASSWORD, created.passwordHash);
        assertTrue(BcryptUtil.matches(TestConstants.VALID_PASSWORD, created.passwordHash));
    }

    @Test
    public void testRegister_duplicateEmailRedirectsToLogin() {
        Response response = given().redirects().follow(false).formParam("username", "Someone Else")
                .formParam("email", TestConstants.VALID_EMAIL).formParam("password", TestConstants.VALID_PASSWORD)
                .when().post("/register");

        response.then().statusCode(303).header("Location", not(containsString("/weather")));
        assertNull(response.getCookie(SESSION_COOKIE));

        // The warning is shown on the next page load
        given().cookie(FLASH_COOKIE, response.getCookie(FLASH_COOKIE)).when().get("/").then().statusCode(200)
                .body(containsString("Email already registered. Please log in instead."));
        assertEquals(1L, QuarkusTransaction.requiringNew().call(() -> User.count("email", TestConstants.VALID_EMAIL)));
    }

    @Test
    public void testRegister_shortPassword() {
        given().redirects().follow(false).formParam("username", "New Person")
                .formParam("email", TestConstants.VALID_EMAIL_2).formParam("password", TestConstants.SHORT_PASSWORD)
                .when().post("/register").then().statusCode(400)
                .body(containsString("Password must be at least 8 characters."));

        assertTrue(QuarkusTransaction.requiringNew().call(() -> User.findByEmail(TestConstants.VALID_EMAIL_2))
                .isEmpty());
    }

    @Test
    public void testRegister_invalidEmail() {
        given().redirects().follow(false).formParam("username", "New Person").formParam("email", "not-an-email")
                .formParam("password", TestConstants.VALID_PASSWORD).when().post("/register").then().statusCode(400)
                .body(containsString("Enter a valid email address."));
    }

    @Test
    public void testRegisterPage_renders() {
        given().when().get("/register").then().statusCode(200).body(containsString("name=\"username\""));
    }

    @Test
    public void testLogout_clearsSessionCookie() {
        Response response = given().redirects().follow(false)
                .cookie(SESSION_COOKIE, authService.createSessionToken(existingUser)).when().get("/logout");

        response.then().statusCode(303).header("Location", not(containsString("/weather")));

        List<String> setCookies = response.getHeaders().getValues("Set-Cookie");
        assertTrue(setCookies.stream().anyMatch(c -> c.startsWith(SESSION_COOKIE + "=") && c.contains("Max-Age=0")),
                "Expected an expired session cookie in " + setCookies);
    }

    @Test
    public void testLogout_requiresLogin() {
        given().redirects().follow(false).when().get("/logout").then().statusCode(303).header("Location",
                not(containsString("/weather")));
    }

    @Test
    public void testTamperedSessionIsAnonymous() {
        String token = authService.createSessionToken(existingUser);
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        given().redirects().follow(false).cookie(SESSION_COOKIE, tampered).when().get("/weather").then()
                .statusCode(303).header("Location", not(containsString("/weather")));
    }
}
