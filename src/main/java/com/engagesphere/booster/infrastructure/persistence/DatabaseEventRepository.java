package com.engagesphere.booster.infrastructure.persistence;

import com.engagesphere.booster.domain.model.Event;
import com.engagesphere.booster.domain.port.out.EventRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class DatabaseEventRepository implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseEventRepository.class);

    private static final String COLUMNS = "e.id, e.name, e.description, e.event_time, e.recording_url, e.image_url";

    private static final RowMapper<Event> EVENT_ROW_MAPPER = DatabaseEventRepository::mapEvent;

    private final JdbcTemplate jdbcTemplate;

    public DatabaseEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Event> findById(long eventId) {
        String sql = "SELECT " + COLUMNS + " FROM events e WHERE e.id = ?";
        return jdbcTemplate.query(sql, EVENT_ROW_MAPPER, eventId).stream().findFirst();
    }

    @Override
    public List<Event> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM events e ORDER BY e.event_time, e.id";
        return jdbcTemplate.query(sql, EVENT_ROW_MAPPER);
    }

    @Override
    public List<Event> findRegisteredBy(long userId) {
        String sql = """
            SELECT %s
            FROM events e
            JOIN registrations r ON r.event_id = e.id
            WHERE r.user_id = ?
            ORDER BY e.event_time, e.id
            """.formatted(COLUMNS);
        return jdbcTemplate.query(sql, EVENT_ROW_MAPPER, userId);
    }

    @Override
    public Event save(Event event) {
        String sql = """
            INSERT INTO events (name, description, event_time, recording_url, image_url, created_at)
            VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            RETURNING id
            """;

        Long id = jdbcTemplate.queryForObject(sql, Long.class,
                event.name(),
                event.description(),
                toOffsetDateTime(event.eventTime()),
                event.recordingUrl(),
                event.imageUrl());

        logger.debug("Inserted event {} '{}'", id, event.name());
        return new Event(id, event.name(), event.description(), event.eventTime(),
                event.recordingUrl(), event.imageUrl());
    }

    @Override
    @Transactional
    public void deleteById(long eventId) {
        try {
            int registrations = jdbcTemplate.update("DELETE FROM registrations WHERE event_id = ?", eventId);
            int events = jdbcTemplate.update("DELETE FROM events WHERE id = ?", eventId);
            logger.debug("Deleted {} event rows and {} registration rows for event {}",
                    events, registrations, eventId);
        } catch (DataAccessException e) {
            logger.error("Error deleting event {}", eventId, e);
            throw e;
        }
    }

    static OffsetDateTime toOffsetDateTime(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static Event mapEvent(ResultSet rs, int rowNum) throws SQLException {
        return new Event(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("description"),
                toInstant(rs, "event_time"),
                rs.getString("recording_url"),
                rs.getString("image_url")
        );
    }
}
