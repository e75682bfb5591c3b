package com.engagesphere.booster.infrastructure.persistence;

import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.UserRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Users table access. Interests are stored as a sorted, comma-delimited string.
 */
@Repository
public class DatabaseUserRepository implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseUserRepository.class);

    private static final String INTEREST_DELIMITER = ",";

    private static final String COLUMNS =
            "id, email, name, job_title, interests, preferred_contact_method, phone_number, is_admin";

    private static final RowMapper<User> USER_ROW_MAPPER = DatabaseUserRepository::mapUser;

    private final JdbcTemplate jdbcTemplate;

    public DatabaseUserRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<User> findById(long userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users WHERE id = ?", USER_ROW_MAPPER, userId)
                .stream().findFirst();
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users WHERE email = ?", USER_ROW_MAPPER, email)
                .stream().findFirst();
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public User save(User user) {
        String sql = """
            INSERT INTO users (
                email, name, job_title, interests, preferred_contact_method, phone_number, is_admin, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            RETURNING id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
                user.email(),
                user.name(),
                user.jobTitle(),
                formatInterests(user.interests()),
                user.preferredContactMethod(),
                user.phoneNumber(),
                user.admin());

        logger.debug("Inserted user {} ({})", id, user.email());
        return new User(id, user.email(), user.name(), user.jobTitle(), user.interests(),
                user.preferredContactMethod(), user.phoneNumber(), user.admin());
    }

    @Override
    public void updateInterests(long userId, Set<String> interests) {
        jdbcTemplate.update("UPDATE users SET interests = ? WHERE id = ?", formatInterests(interests), userId);
    }

    @Override
    public void updateContact(long userId, String preferredContactMethod, String phoneNumber) {
        jdbcTemplate.update("UPDATE users SET preferred_contact_method = ?, phone_number = ? WHERE id = ?",
                preferredContactMethod, phoneNumber, userId);
    }

    static String formatInterests(Set<String> interests) {
        if (interests == null || interests.isEmpty()) {
            return null;
        }
        return String.join(INTEREST_DELIMITER, new TreeSet<>(interests));
    }

    static SortedSet<String> parseInterests(String value) {
        SortedSet<String> interests = new TreeSet<>();
        if (value == null || value.isBlank()) {
            return interests;
        }
        Arrays.stream(value.split(INTEREST_DELIMITER))
                .map(String::trim)
                .filter(interest -> !interest.isEmpty())
                .forEach(interests::add);
        return interests;
    }

    private static User mapUser(ResultSet rs, int rowNum) throws SQLException {
        return new User(
                rs.getLong("id"),
                rs.getString("email"),
                rs.getString("name"),
                rs.getString("job_title"),
                parseInterests(rs.getString("interests")),
                rs.getString("preferred_contact_method"),
                rs.getString("phone_number"),
                rs.getBoolean("is_admin")
        );
    }
}
