package villagecompute.weatherboard.api.types;

import io.quarkus.qute.TemplateData;

/**
 * One-shot message shown on the next rendered page.
 *
 * @param category
 *            Bootstrap alert flavour: success, info, warning or error
 * @param message
 *            text shown to the user
 */
@TemplateData
public record FlashMessageType(String category, String message) {

    public static final String SUCCESS = "success";
    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";

    /**
     * @return Bootstrap contextual class for the alert ("danger" for errors)
     */
    public String cssClass() {
        return ERROR.equals(category) ? "danger" : category;
    }
}
