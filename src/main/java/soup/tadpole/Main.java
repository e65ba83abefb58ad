package soup.tadpole;

import soup.tadpole.engine.search.SearchConfig;
import soup.tadpole.engine.uci.UciServer;

public class Main {
    public static void main(String[] args) {
        new UciServer("Tadpole", "soup", SearchConfig.fromSystemProperties()).run();
    }
}
