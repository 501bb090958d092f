package villagecompute.weatherboard.config;

import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the Weatherboard JSON API.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI Spec</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Village Weatherboard API",
                version = "1.0.0",
                description = """
                        Current weather for the cities on a signed-in user's dashboard.

                        ## Authentication
                        Sign in through the web pages (password or Google); the session cookie authorizes API calls.

                        ## Caching
                        Snapshots are cached per city for five minutes. Cities whose provider call failed are
                        reported by id instead of failing the whole request.
                        """,
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Weather",
                description = "Current weather for the signed-in user's cities")},
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "sessionCookie",
                        type = SecuritySchemeType.APIKEY,
                        apiKeyName = "wb_session",
                        in = SecuritySchemeIn.COOKIE,
                        description = "Signed session cookie issued at login.")}))
public class OpenApiConfig extends Application {
    // Configuration via annotations only
}
