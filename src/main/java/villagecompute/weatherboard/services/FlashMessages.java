package villagecompute.weatherboard.services;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.RequestScoped;
import villagecompute.weatherboard.api.types.FlashMessageType;

/**
 * One-shot messages for the current request.
 *
 * <p>
 * Messages carried in by the flash cookie and messages added while handling the request are pending until a page
 * {@link #drain() drains} them. Anything still pending when the response is written (typically on a redirect) is
 * carried forward to the next request by {@link villagecompute.weatherboard.api.filters.SessionFilter}.
 */
@RequestScoped
public class FlashMessages {

    private final List<FlashMessageType> pending = new ArrayList<>();
    private boolean carriedIn;

    public void success(String message) {
        add(FlashMessageType.SUCCESS, message);
    }

    public void info(String message) {
        add(FlashMessageType.INFO, message);
    }

    public void warning(String message) {
        add(FlashMessageType.WARNING, message);
    }

    public void error(String message) {
        add(FlashMessageType.ERROR, message);
    }

    public void add(String category, String message) {
        pending.add(new FlashMessageType(category, message));
    }

    /**
     * Returns all pending messages and marks them as shown.
     */
    public List<FlashMessageType> drain() {
        List<FlashMessageType> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    public List<FlashMessageType> pending() {
        return List.copyOf(pending);
    }

    public boolean wasCarriedIn() {
        return carriedIn;
    }

    /**
     * Called whenever the request carried a flash cookie, readable or not, so the response expires it.
     */
    void carryIn(List<FlashMessageType> messages) {
        pending.addAll(0, messages);
        carriedIn = true;
    }
}
