package org.pubsearch.search;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.pubsearch.search.bootstrap.SearchBootstrap;
import org.pubsearch.search.model.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line search: starts the engine and prints one page of results as JSON.
 */
public class SearchApp {
    private static final Logger logger = LoggerFactory.getLogger(SearchApp.class);

    public static void main(String[] args) {
        int page = 1;
        int perPage = 0;
        String sortBy = "relevance";
        boolean rebuild = false;
        List<String> words = new ArrayList<>();

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "-h", "--help" -> {
                        printUsage();
                        return;
                    }
                    case "--rebuild" -> rebuild = true;
                    case "--page" -> page = Integer.parseInt(args[++i]);
                    case "--per-page" -> perPage = Integer.parseInt(args[++i]);
                    case "--sort" -> sortBy = args[++i];
                    default -> words.add(args[i]);
                }
            }
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            logger.error("Invalid arguments", e);
            printUsage();
            System.exit(1);
        }

        try {
            SearchBootstrap.SearchRuntime runtime = SearchBootstrap.load();
            if (rebuild) {
                runtime.indexingService().rebuildFromFile();
            }
            SearchResponse response = runtime.queryProcessor().search(String.join(" ", words), page, perPage, sortBy);

            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            System.out.println(gson.toJson(response));
        } catch (Exception e) {
            logger.error("Search failed", e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("\n=== Search Usage ===\n");
        System.out.println("Usage: java -jar search-service-1.0.0.jar [options] <query words>\n");
        System.out.println("Options:");
        System.out.println("  --page <n>          Page to show (default: 1)");
        System.out.println("  --per-page <n>      Results per page (default: search.results.per.page)");
        System.out.println("  --sort <order>      relevance, year_desc or year_asc (default: relevance)");
        System.out.println("  --rebuild           Rebuild the index from the publications file first");
        System.out.println("  -h, --help          Show this help message\n");
        System.out.println("Examples:");
        System.out.println("  java -jar search-service-1.0.0.jar deep learning");
        System.out.println("  java -jar search-service-1.0.0.jar --sort year_desc --page 2 graph mining\n");
    }
}
