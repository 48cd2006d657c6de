package com.example.stlabels.service.extraction;

import com.example.stlabels.config.StLabelsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Поиск адреса устройства по регулярному выражению: префикс из настроек,
 * за которым следуют цифры. Адрес не должен быть частью более длинного слова
 * (MAX10 не содержит X10), но может граничить с подчёркиванием (START_X0).
 */
@Slf4j
@Component
public class PatternDeviceAddressMatcher implements DeviceAddressMatcher {

    private final Pattern devicePattern;

    public PatternDeviceAddressMatcher(StLabelsConfig config) {
        this.devicePattern = buildPattern(config.getLabels().getDevicePrefixes());
    }

    @Override
    public Optional<String> findDevice(String name, String comment) {
        Optional<String> fromComment = find(comment);
        if (fromComment.isPresent()) {
            return fromComment;
        }
        return find(name);
    }

    private Optional<String> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = devicePattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group(1).toUpperCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    static Pattern buildPattern(String prefixes) {
        StringBuilder letters = new StringBuilder();
        if (prefixes != null) {
            for (char c : prefixes.toCharArray()) {
                if (Character.isLetter(c)) {
                    letters.append(c);
                }
            }
        }
        if (letters.length() == 0) {
            log.warn("No device prefixes configured, device matching is disabled");
            return Pattern.compile("(?!)(.)");
        }
        return Pattern.compile("(?<![A-Za-z0-9])([" + letters + "]\\d+)(?![A-Za-z0-9])",
                Pattern.CASE_INSENSITIVE);
    }
}
