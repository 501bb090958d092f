package villagecompute.weatherboard.services;

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
import villagecompute.weatherboard.exceptions.ResourceNotFoundException;
import villagecompute.weatherboard.testing.H2TestResource;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for {@link UserCityService}.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class UserCityServiceTest extends BaseIntegrationTest {

    @Inject
    UserCityService userCityService;

    @BeforeEach
    @Transactional
    void cleanDatabase() {
        UserCity.deleteAll();
        User.deleteAll();
    }

    @Test
    @Transactional
    void testAddCity_persistsSubscription() {
        User user = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);

        UserCity city = userCityService.addCity(user.id, TestConstants.LONDON_CITY_ID);

        assertEntityExists(UserCity.class, city.id);
        assertEquals(user.id, city.user.id);
        assertEquals(TestConstants.LONDON_CITY_ID, city.cityId);
        assertTrue(userCityService.isTracked(user.id, TestConstants.LONDON_CITY_ID));
    }

    @Test
    @Transactional
    void testAddCity_duplicateRejected() {
        User user = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
        userCityService.addCity(user.id, TestConstants.LONDON_CITY_ID);

        assertEquals(1, userCityService.listCityIds(user.id).size());
        assertThrows(DuplicateResourceException.class,
                () -> userCityService.addCity(user.id, TestConstants.LONDON_CITY_ID));
    }

    @Test
    @Transactional
    void testAddCity_sameCityForDifferentUsers() {
        User first = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
        User second = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL_2);

        userCityService.addCity(first.id, TestConstants.LONDON_CITY_ID);
        userCityService.addCity(second.id, TestConstants.LONDON_CITY_ID);

        assertEquals(List.of(TestConstants.LONDON_CITY_ID), userCityService.listCityIds(first.id));
        assertEquals(List.of(TestConstants.LONDON_CITY_ID), userCityService.listCityIds(second.id));
    }

    @Test
    @Transactional
    void testAddCity_unknownUser() {
        assertThrows(ResourceNotFoundException.class,
                () -> userCityService.addCity(UUID.randomUUID(), TestConstants.LONDON_CITY_ID));
    }

    @Test
    @Transactional
    void testListCityIds_keepsInsertionOrder() {
        User user = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
        userCityService.addCity(user.id, TestConstants.LONDON_CITY_ID);
        userCityService.addCity(user.id, TestConstants.PARIS_CITY_ID);

        assertEquals(List.of(TestConstants.LONDON_CITY_ID, TestConstants.PARIS_CITY_ID),
                userCityService.listCityIds(user.id));
    }

    @Test
    @Transactional
    void testRemoveCity() {
        User user = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
        UserCity city = userCityService.addCity(user.id, TestConstants.LONDON_CITY_ID);

        userCityService.removeCity(user.id, TestConstants.LONDON_CITY_ID);

        assertEntityAbsent(UserCity.class, city.id);
        assertFalse(userCityService.isTracked(user.id, TestConstants.LONDON_CITY_ID));
    }

    @Test
    @Transactional
    void testRemoveCity_notOwned() {
        User owner = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL);
        User other = TestFixtures.createLocalUser(TestConstants.VALID_EMAIL_2);
        userCityService.addCity(owner.id, TestConstants.LONDON_CITY_ID);

        assertThrows(ResourceNotFoundException.class,
                () -> userCityService.removeCity(other.id, TestConstants.LONDON_CITY_ID));
    }
}
