package visconnect.viewer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Splits a command line into words and resolves the abbreviated command.
 * Commas count as spaces, so {@code array 1,2,3} has three arguments.
 */
public class CommandParser {

    public static List<String> tokenize(String line) {
        if (line == null) {
            return List.of();
        }
        String normalised = line.replace(',', ' ').trim();
        if (normalised.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalised.split("\\s+"));
    }

    /**
     * @return the command, or empty if the line is blank or names no known command
     */
    public Optional<Command> parse(String line) {
        List<String> tokens = tokenize(line);
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        CommandWord word = CommandWord.match(tokens.get(0));
        if (word == null) {
            return Optional.empty();
        }
        return Optional.of(new Command(word, tokens.subList(1, tokens.size())));
    }
}
