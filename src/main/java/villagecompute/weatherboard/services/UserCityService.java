package villagecompute.weatherboard.services;

import java.util.List;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.weatherboard.data.models.User;
import villagecompute.weatherboard.data.models.UserCity;
import villagecompute.weatherboard.exceptions.DuplicateResourceException;
import villagecompute.weatherboard.exceptions.ResourceNotFoundException;

/**
 * Manages the cities on each user's dashboard.
 */
@ApplicationScoped
public class UserCityService {

    private static final Logger LOG = Logger.getLogger(UserCityService.class);

    /**
     * @return the user's city identifiers, oldest subscription first
     */
    public List<Long> listCityIds(UUID userId) {
        return UserCity.findByUser(userId).stream().map(city -> city.cityId).toList();
    }

    public boolean isTracked(UUID userId, long cityId) {
        return UserCity.findByUserAndCity(userId, cityId).isPresent();
    }

    /**
     * Adds a city to the user's dashboard.
     *
     * @throws ResourceNotFoundException
     *             if the user no longer exists
     * @throws DuplicateResourceException
     *             if the city is already tracked
     */
    @Transactional
    public UserCity addCity(UUID userId, long cityId) {
        User user = User.findById(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }
        if (UserCity.findByUserAndCity(userId, cityId).isPresent()) {
            throw new DuplicateResourceException("City " + cityId + " already tracked by user " + userId);
        }

        UserCity city = UserCity.create(user, cityId);
        LOG.infof("User %s added city %d", userId, cityId);
        return city;
    }

    /**
     * Removes a city from the user's dashboard. Only the owner's subscription is ever matched.
     *
     * @throws ResourceNotFoundException
     *             if the user does not track the city
     */
    @Transactional
    public void removeCity(UUID userId, long cityId) {
        UserCity city = UserCity.findByUserAndCity(userId, cityId)
                .orElseThrow(() -> new ResourceNotFoundException("City " + cityId + " not tracked by user " + userId));
        city.delete();
        LOG.infof("User %s removed city %d", userId, cityId);
    }
}
