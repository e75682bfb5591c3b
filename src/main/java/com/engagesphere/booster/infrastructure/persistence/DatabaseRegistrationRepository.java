package com.engagesphere.booster.infrastructure.persistence;

import com.engagesphere.booster.domain.exception.AlreadyRegisteredException;
import com.engagesphere.booster.domain.model.Registration;
import com.engagesphere.booster.domain.port.out.RegistrationRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class DatabaseRegistrationRepository implements RegistrationRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseRegistrationRepository.class);

    private static final String COLUMNS = "id, user_id, event_id, registration_time";

    private static final RowMapper<Registration> REGISTRATION_ROW_MAPPER = DatabaseRegistrationRepository::mapRegistration;

    private final JdbcTemplate jdbcTemplate;

    public DatabaseRegistrationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Registration> find(long userId, long eventId) {
        String sql = "SELECT " + COLUMNS + " FROM registrations WHERE user_id = ? AND event_id = ?";
        return jdbcTemplate.query(sql, REGISTRATION_ROW_MAPPER, userId, eventId).stream().findFirst();
    }

    @Override
    public List<Registration> findByEventId(long eventId) {
        String sql = "SELECT " + COLUMNS + " FROM registrations WHERE event_id = ? ORDER BY id";
        return jdbcTemplate.query(sql, REGISTRATION_ROW_MAPPER, eventId);
    }

    @Override
    public Registration create(long userId, long eventId, Instant registrationTime) {
        String sql = """
            INSERT INTO registrations (user_id, event_id, registration_time)
            VALUES (?, ?, ?)
            RETURNING id
            """;

        Long id;
        try {
            id = jdbcTemplate.queryForObject(sql, Long.class,
                    userId, eventId, DatabaseEventRepository.toOffsetDateTime(registrationTime));
        } catch (DuplicateKeyException e) {
            logger.warn("Registration of user {} for event {} already exists", userId, eventId);
            throw new AlreadyRegisteredException(userId, eventId);
        }

        logger.debug("Inserted registration {} for user {} and event {}", id, userId, eventId);
        return new Registration(id, userId, eventId, registrationTime);
    }

    @Override
    public boolean delete(long userId, long eventId) {
        int deleted = jdbcTemplate.update("DELETE FROM registrations WHERE user_id = ? AND event_id = ?",
                userId, eventId);
        return deleted > 0;
    }

    private static Registration mapRegistration(ResultSet rs, int rowNum) throws SQLException {
        return new Registration(
                rs.getLong("id"),
                rs.getLong("user_id"),
                rs.getLong("event_id"),
                DatabaseEventRepository.toInstant(rs, "registration_time")
        );
    }
}
