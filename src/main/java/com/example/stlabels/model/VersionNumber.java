package com.example.stlabels.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Семантическая версия MAJOR.MINOR.PATCH.
 */
@Value
public class VersionNumber implements Comparable<VersionNumber> {

    /**
     * Версия этапа, для которого ещё нет ни одной записи в журнале.
     * Первое действие применяет своё правило инкремента к этой версии.
     */
    public static final VersionNumber INITIAL = new VersionNumber(1, 0, 0);

    private static final Pattern VERSION_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private static final Comparator<VersionNumber> ORDER = Comparator
            .comparingInt(VersionNumber::getMajor)
            .thenComparingInt(VersionNumber::getMinor)
            .thenComparingInt(VersionNumber::getPatch);

    int major;
    int minor;
    int patch;

    @JsonCreator
    public static VersionNumber parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version text is null");
        }
        Matcher matcher = VERSION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid version number: " + text);
        }
        try {
            return new VersionNumber(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version number: " + text, e);
        }
    }

    /**
     * Возвращает следующую версию по правилу инкремента действия.
     * MAJOR не изменяется ни одним действием.
     */
    public VersionNumber next(ActionType actionType) {
        switch (actionType.getIncrement()) {
            case MINOR:
                return new VersionNumber(major, minor + 1, 0);
            case PATCH:
                return new VersionNumber(major, minor, patch + 1);
            default:
                throw new IllegalStateException("Unsupported increment: " + actionType.getIncrement());
        }
    }

    @Override
    public int compareTo(VersionNumber other) {
        return ORDER.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
