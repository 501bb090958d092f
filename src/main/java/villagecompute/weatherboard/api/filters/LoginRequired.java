package villagecompute.weatherboard.api.filters;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JAX-RS name binding annotation restricting a resource to authenticated users.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * &#64;GET
 * &#64;Path("/weather")
 * &#64;LoginRequired
 * public Response dashboard() {
 *     // Implementation
 * }
 * </pre>
 *
 * <p>
 * Anonymous HTML requests are redirected to the login page with a flash message; JSON API requests receive 401.
 *
 * @see LoginRequiredFilter for enforcement implementation
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface LoginRequired {
}
