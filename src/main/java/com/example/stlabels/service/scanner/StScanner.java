package com.example.stlabels.service.scanner;

import com.example.stlabels.model.Section;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Лексический сканер Structured Text.
 * <p>
 * Разбивает текст на строки и классифицирует каждую из них, отслеживая текущую
 * секцию объявлений (NONE, GLOBAL, LOCAL). Ни одна строка не отвергается.
 * <p>
 * Вложенное открытие блока внутри открытой секции помечается как
 * {@link LineKind#NESTED_OPEN} и не меняет секцию: следующий END_VAR закрывает
 * внешний блок.
 */
@Component
public class StScanner {

    // VAR, VAR_INPUT, VAR_GLOBAL_RETAIN, VAR CONSTANT ... с необязательным комментарием
    private static final Pattern OPEN_PATTERN = Pattern.compile(
            "^(VAR(?:_[A-Z_]+)?)(?:\\s+(?:CONSTANT|RETAIN|NON_RETAIN|PERSISTENT))*\\s*(?://.*|\\(\\*.*)?$");

    private static final Pattern END_VAR_PATTERN = Pattern.compile("^END_VAR\\s*;?\\s*(?://.*|\\(\\*.*)?$");

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    /**
     * Сканирует текст. Каждый вызов начинает с секции NONE.
     *
     * @param source исходный текст (null рассматривается как пустой)
     * @return ленивый поток классифицированных строк
     */
    public Stream<ScannedLine> scan(String source) {
        if (source == null || source.isEmpty()) {
            return Stream.empty();
        }
        String[] lines = LINE_BREAK.split(source, -1);
        return StreamSupport.stream(
                Spliterators.spliterator(new LineIterator(lines), lines.length,
                        Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Классифицирует одну строку относительно текущей секции.
     */
    static LineKind classify(String line, Section current) {
        String trimmed = line.trim();

        Matcher open = OPEN_PATTERN.matcher(trimmed);
        if (open.matches()) {
            if (current != Section.NONE) {
                return LineKind.NESTED_OPEN;
            }
            return open.group(1).startsWith("VAR_GLOBAL") ? LineKind.GLOBAL_OPEN : LineKind.LOCAL_OPEN;
        }

        if (END_VAR_PATTERN.matcher(trimmed).matches() && current != Section.NONE) {
            return LineKind.END_VAR;
        }

        return current == Section.NONE ? LineKind.BODY : LineKind.DECLARATION;
    }

    private static final class LineIterator implements Iterator<ScannedLine> {
        private final String[] lines;
        private int index;
        private Section section = Section.NONE;

        private LineIterator(String[] lines) {
            this.lines = lines;
        }

        @Override
        public boolean hasNext() {
            return index < lines.length;
        }

        @Override
        public ScannedLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String text = lines[index];
            int lineNumber = ++index;
            LineKind kind = classify(text, section);

            switch (kind) {
                case GLOBAL_OPEN:
                    section = Section.GLOBAL;
                    return new ScannedLine(lineNumber, text, kind, section);
                case LOCAL_OPEN:
                    section = Section.LOCAL;
                    return new ScannedLine(lineNumber, text, kind, section);
                case END_VAR:
                    Section closed = section;
                    section = Section.NONE;
                    return new ScannedLine(lineNumber, text, kind, closed);
                default:
                    return new ScannedLine(lineNumber, text, kind, section);
            }
        }
    }
}
