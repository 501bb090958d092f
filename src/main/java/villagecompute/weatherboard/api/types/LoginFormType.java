package villagecompute.weatherboard.api.types;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.FormParam;

/**
 * Login form submitted to {@code POST /}.
 */
public class LoginFormType {

    @FormParam("email")
    @NotBlank(
            message = "Email is required.")
    @Email(
            message = "Enter a valid email address.")
    public String email;

    @FormParam("password")
    @NotBlank(
            message = "Password is required.")
    public String password;
}
