package visconnect.viewer;

import java.util.List;

/**
 * A recognised command and its argument words.
 */
public record Command(CommandWord word, List<String> args) {

    public Command {
        args = List.copyOf(args);
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    public String arg(int index) {
        return args.get(index);
    }
}
