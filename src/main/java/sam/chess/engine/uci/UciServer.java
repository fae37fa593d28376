package sam.chess.engine.uci;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Line protocol front end for chess GUIs. Reads one command per line and answers on the output
 * stream; selection is a single ply, so "go" is answered before the next command is read.
 */
public final class UciServer {
    private static final Logger log = LoggerFactory.getLogger(UciServer.class);

    private final String name;
    private final String author;
    private final UciEngine engine;
    private final BufferedReader in;
    private final PrintStream out;

    public UciServer(String name, String author, UciEngine engine) {
        this(name, author, engine, System.in, System.out);
    }

    public UciServer(String name, String author, UciEngine engine, InputStream input, OutputStream output) {
        this.name = Objects.requireNonNull(name);
        this.author = Objects.requireNonNull(author);
        this.engine = Objects.requireNonNull(engine);
        this.in = new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII));
        this.out = new PrintStream(output, true, StandardCharsets.US_ASCII);
    }

    /** Serves commands until "quit" or the end of input. */
    public void run() {
        String line;
        while((line = readLine()) != null) {
            List<String> tokens = tokenize(line);
            if(tokens.isEmpty()) {
                continue;
            }
            String command = tokens.get(0);
            List<String> arguments = tokens.subList(1, tokens.size());
            if(command.equals("quit")) {
                return;
            }
            dispatch(command, arguments);
        }
    }

    private void dispatch(String command, List<String> arguments) {
        switch (command) {
            case "uci" -> {
                out.println("id name " + name);
                out.println("id author " + author);
                engine.options().forEach(out::println);
                out.println("uciok");
            }
            case "isready" -> {
                engine.onIsReady();
                out.println("readyok");
            }
            case "ucinewgame" -> engine.newGame();
            case "setoption" -> setOption(arguments);
            case "position" -> setPosition(arguments);
            case "go" -> {
                log.debug("go {}", arguments);
                UciResult result = engine.search(out::println);
                out.println("bestmove " + (result.hasMove() ? result.bestMove() : UciResult.NULL_MOVE));
            }
            case "print" -> engine.debugDump(out::println);
            // Nothing runs in the background, there is never a search to stop
            case "stop" -> { }
            default -> log.debug("Unknown command {} {}", command, arguments);
        }
    }

    // setoption name <words...> [value <words...>]
    private void setOption(List<String> arguments) {
        int nameAt = arguments.indexOf("name");
        if(nameAt < 0) {
            log.debug("setoption without a name: {}", arguments);
            return;
        }
        int valueAt = arguments.indexOf("value");
        int nameEnd = valueAt > nameAt ? valueAt : arguments.size();
        String optionName = String.join(" ", arguments.subList(nameAt + 1, nameEnd));
        String value = valueAt > nameAt ? String.join(" ", arguments.subList(valueAt + 1, arguments.size())) : "";
        engine.setOption(optionName, value);
    }

    // position (startpos | fen <six fields>) [moves <m1> <m2> ...]
    private void setPosition(List<String> arguments) {
        if(arguments.isEmpty()) {
            return;
        }
        int movesAt = arguments.indexOf("moves");
        List<String> setup = movesAt < 0 ? arguments : arguments.subList(0, movesAt);
        List<String> moves = movesAt < 0 ? List.of() : arguments.subList(movesAt + 1, arguments.size());
        try {
            switch (setup.get(0)) {
                case "startpos" -> engine.setPositionStartpos(moves);
                case "fen" -> engine.setPositionFEN(String.join(" ", setup.subList(1, setup.size())), moves);
                default -> log.debug("Position neither startpos nor fen: {}", arguments);
            }
        } catch (IllegalArgumentException e) {
            log.warn("Position {} rejected: {}", arguments, e.getMessage());
            out.println("info string " + e.getMessage());
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read the command stream", e);
        }
    }

    static List<String> tokenize(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
    }
}
