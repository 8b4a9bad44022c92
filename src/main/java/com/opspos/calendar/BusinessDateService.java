package com.opspos.calendar;

import com.opspos.domain.vo.BusinessDateRange;
import com.opspos.domain.vo.BusinessDateSettings;
import com.opspos.entity.PropertyEntity;
import com.opspos.exception.InvalidConfigurationException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Maps instants to the restaurant "business date" (operating day) of a property.
 *
 * <p>A business date does not follow the calendar: a 04:00 rollover keeps 02:30 sales on the
 * previous day's books. Two families of rollover are supported:
 * <ul>
 *   <li>AM rollover (hour &lt; 12): local time before the rollover belongs to the previous
 *       calendar day. The period for date D closes at the rollover on D+1.</li>
 *   <li>PM rollover (hour &gt;= 12): local time at or after the rollover belongs to the next
 *       calendar day. The period for date D closes at the rollover on D itself.</li>
 * </ul>
 *
 * <p>The derived date is defined through closing instants: an instant belongs to D when it is
 * in [closing(D-1), closing(D)). Closing instants are strictly increasing, so resolution is
 * monotonic in time even across DST transitions that repeat or skip the rollover wall time.
 *
 * <p>An explicit {@code currentBusinessDate} on the property always wins in
 * {@link #resolveBusinessDate}. Scheduling decisions use {@link #deriveBusinessDate} and
 * {@link #hasReachedClosingTime}, which only look at the clock.
 */
@Service
public class BusinessDateService {

    private static final Pattern ROLLOVER_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");

    private static final DateTimeFormatter BUSINESS_DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    private final BusinessDateConfig businessDateConfig;
    private final Clock clock;

    public BusinessDateService(BusinessDateConfig businessDateConfig, Clock clock) {
        this.businessDateConfig = businessDateConfig;
        this.clock = clock;
    }

    // ---- Resolution ----

    public LocalDate resolveBusinessDate(Instant timestamp, PropertyEntity property) {
        return resolveBusinessDate(timestamp, settingsFor(property));
    }

    public LocalDate resolveBusinessDate(Instant timestamp, BusinessDateSettings settings) {
        if (settings.getCurrentBusinessDate() != null) {
            return settings.getCurrentBusinessDate();
        }
        return deriveBusinessDate(timestamp, settings);
    }

    public LocalDate getCurrentBusinessDate(PropertyEntity property) {
        return resolveBusinessDate(clock.instant(), property);
    }

    public LocalDate deriveBusinessDate(Instant timestamp, PropertyEntity property) {
        return deriveBusinessDate(timestamp, settingsFor(property));
    }

    /**
     * Time-only derivation that ignores any explicit override.
     */
    public LocalDate deriveBusinessDate(Instant timestamp, BusinessDateSettings settings) {
        ZonedDateTime local = timestamp.atZone(settings.getZoneId());
        LocalDate calendarDate = local.toLocalDate();
        LocalTime timeOfDay = local.toLocalTime();

        LocalDate candidate;
        if (settings.isPmRollover()) {
            candidate = timeOfDay.isBefore(settings.getRolloverTime()) ? calendarDate : calendarDate.plusDays(1);
        } else {
            candidate = timeOfDay.isBefore(settings.getRolloverTime()) ? calendarDate.minusDays(1) : calendarDate;
        }

        // Wall-clock comparison is off by one around DST shifts; the closing instants are authoritative
        while (timestamp.isBefore(getBusinessDateClosingInstant(candidate.minusDays(1), settings))) {
            candidate = candidate.minusDays(1);
        }
        while (!timestamp.isBefore(getBusinessDateClosingInstant(candidate, settings))) {
            candidate = candidate.plusDays(1);
        }
        return candidate;
    }

    // ---- Closing instants and ranges ----

    public Instant getBusinessDateClosingInstant(LocalDate businessDate, PropertyEntity property) {
        return getBusinessDateClosingInstant(businessDate, settingsFor(property));
    }

    public Instant getBusinessDateClosingInstant(LocalDate businessDate, BusinessDateSettings settings) {
        LocalDate closingDay = settings.isPmRollover() ? businessDate : businessDate.plusDays(1);
        // ZonedDateTime.of moves gap times forward and picks the earlier offset in overlaps
        return ZonedDateTime.of(closingDay, settings.getRolloverTime(), settings.getZoneId())
                .toInstant();
    }

    public BusinessDateRange getBusinessDateRange(LocalDate businessDate, PropertyEntity property) {
        BusinessDateSettings settings = settingsFor(property);
        return new BusinessDateRange(
                businessDate,
                getBusinessDateClosingInstant(businessDate.minusDays(1), settings),
                getBusinessDateClosingInstant(businessDate, settings));
    }

    public boolean hasReachedClosingTime(LocalDate businessDate, PropertyEntity property, Instant now) {
        return !now.isBefore(getBusinessDateClosingInstant(businessDate, property));
    }

    /**
     * True when the business date resolved at {@code now} differs from the last one the caller saw.
     */
    public boolean hasBusinessDateChanged(LocalDate lastKnownBusinessDate, PropertyEntity property, Instant now) {
        return !resolveBusinessDate(now, property).equals(lastKnownBusinessDate);
    }

    public LocalDate incrementDate(LocalDate businessDate) {
        return businessDate.plusDays(1);
    }

    public boolean isValidBusinessDateFormat(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            LocalDate.parse(value, BUSINESS_DATE_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    public LocalDate parseBusinessDate(String value) {
        if (!isValidBusinessDateFormat(value)) {
            throw new InvalidConfigurationException(
                    "Business date must be YYYY-MM-DD", Map.of("businessDate", String.valueOf(value)));
        }
        return LocalDate.parse(value, BUSINESS_DATE_FORMAT);
    }

    // ---- Configuration ----

    /**
     * Applies defaults and parses the property's business-date configuration.
     *
     * @throws InvalidConfigurationException if the stored timezone or rollover time is malformed
     */
    public BusinessDateSettings settingsFor(PropertyEntity property) {
        String timezone = isBlank(property.getTimezone()) ? businessDateConfig.getDefaultTimezone() : property.getTimezone();
        String rollover = isBlank(property.getRolloverTime())
                ? businessDateConfig.getDefaultRolloverTime()
                : property.getRolloverTime();
        return BusinessDateSettings.builder()
                .zoneId(parseZone(timezone))
                .rolloverTime(parseRolloverTime(rollover))
                .currentBusinessDate(property.getCurrentBusinessDate())
                .build();
    }

    /**
     * Validates a rollover configuration before it is stored. AM rollovers are always
     * accepted; PM rollovers only when {@code ops-pos.business-date.allow-pm-rollover} is set.
     */
    public void validateRolloverConfiguration(String timezone, String rolloverTime) {
        if (!isBlank(timezone)) {
            parseZone(timezone);
        }
        if (isBlank(rolloverTime)) {
            return;
        }
        LocalTime parsed = parseRolloverTime(rolloverTime);
        if (parsed.getHour() >= 12 && !businessDateConfig.isAllowPmRollover()) {
            throw new InvalidConfigurationException(
                    "PM rollover times are not enabled; use an early-morning rollover (00:00-11:59)",
                    Map.of("rolloverTime", rolloverTime));
        }
    }

    private ZoneId parseZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("Unknown timezone: " + timezone, Map.of("timezone", timezone));
        }
    }

    private LocalTime parseRolloverTime(String rolloverTime) {
        Matcher matcher = ROLLOVER_PATTERN.matcher(rolloverTime);
        if (!matcher.matches()) {
            throw new InvalidConfigurationException(
                    "Rollover time must be HH:MM (24h)", Map.of("rolloverTime", rolloverTime));
        }
        return LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
