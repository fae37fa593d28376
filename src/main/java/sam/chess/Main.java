package sam.chess;

import sam.chess.engine.uci.UciEngine;
import sam.chess.engine.uci.UciEngineImpl;
import sam.chess.engine.uci.UciServer;

public class Main {
    public static void main(String[] args) {
        UciEngine engine = new UciEngineImpl();
        new UciServer("SamChess", "Sam", engine).run();
    }
}
