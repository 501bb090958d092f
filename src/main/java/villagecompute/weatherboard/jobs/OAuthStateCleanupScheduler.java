package villagecompute.weatherboard.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.weatherboard.data.models.OAuthState;

/**
 * Deletes OAuth state tokens left behind by abandoned Google sign-ins.
 *
 * <p>
 * Completed flows delete their token on the callback; this only clears tokens whose 5 minute TTL has passed.
 */
@ApplicationScoped
public class OAuthStateCleanupScheduler {

    private static final Logger LOG = Logger.getLogger(OAuthStateCleanupScheduler.class);

    @Scheduled(
            cron = "0 0 * * * ?",
            identity = "oauth-state-cleanup")
    @Transactional
    public void cleanupExpiredStates() {
        long deleted = OAuthState.deleteExpired();

        if (deleted > 0) {
            LOG.infof("SECURITY: Deleted %d expired OAuth state tokens", deleted);
        }
    }
}
