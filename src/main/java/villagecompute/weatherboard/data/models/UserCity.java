package villagecompute.weatherboard.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A city on a user's dashboard.
 *
 * <p>
 * {@code city_id} is the OpenWeatherMap city identifier returned by the name lookup. A city appears at most once per
 * user, enforced by the {@code (user_id, city_id)} unique constraint.
 */
@Entity
@Table(
        name = "user_cities",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_user_cities_user_city",
                columnNames = {"user_id", "city_id"}))
public class UserCity extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @ManyToOne(
            fetch = FetchType.LAZY,
            optional = false)
    @JoinColumn(
            name = "user_id",
            nullable = false)
    public User user;

    @Column(
            name = "city_id",
            nullable = false)
    public long cityId;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    /**
     * Lists the user's cities in the order they were added.
     *
     * @param userId
     *            owning user
     * @return subscriptions, oldest first
     */
    public static List<UserCity> findByUser(UUID userId) {
        return list("user.id", Sort.by("createdAt").and("cityId"), userId);
    }

    /**
     * Finds one of the user's cities.
     *
     * @param userId
     *            owning user
     * @param cityId
     *            OpenWeatherMap city identifier
     * @return Optional containing the subscription if the user tracks the city
     */
    public static Optional<UserCity> findByUserAndCity(UUID userId, long cityId) {
        return find("user.id = ?1 AND cityId = ?2", userId, cityId).firstResultOptional();
    }

    /**
     * Creates and persists a subscription. Must be called inside a transaction.
     */
    public static UserCity create(User user, long cityId) {
        UserCity city = new UserCity();
        city.user = user;
        city.cityId = cityId;
        city.createdAt = Instant.now();
        city.persist();
        return city;
    }
}
