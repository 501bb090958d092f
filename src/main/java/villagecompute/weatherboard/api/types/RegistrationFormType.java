package villagecompute.weatherboard.api.types;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.FormParam;

/**
 * Registration form submitted to {@code POST /register}.
 */
public class RegistrationFormType {

    @FormParam("username")
    @NotBlank(
            message = "Username is required.")
    @Size(
            max = 250,
            message = "Username must be at most 250 characters.")
    public String username;

    @FormParam("email")
    @NotBlank(
            message = "Email is required.")
    @Email(
            message = "Enter a valid email address.")
    @Size(
            max = 250,
            message = "Email must be at most 250 characters.")
    public String email;

    @FormParam("password")
    @NotBlank(
            message = "Password is required.")
    @Size(
            min = 8,
            message = "Password must be at least 8 characters.")
    public String password;
}
