package im.arun.newick.io;

import im.arun.newick.config.ConfigLoader;
import im.arun.newick.config.NewickConfig;
import im.arun.newick.format.NewickWriter;
import im.arun.newick.model.Forest;
import im.arun.newick.parse.NewickParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes Newick files.
 */
public class NewickFiles {
    private static final Logger logger = LoggerFactory.getLogger(NewickFiles.class);

    private final NewickConfig config;
    private final NewickParser parser;

    public NewickFiles() {
        this(new ConfigLoader().load());
    }

    public NewickFiles(NewickConfig config) {
        this.config = config;
        this.parser = new NewickParser(config);
    }

    /**
     * Load all trees of a file, decoded with the configured encoding.
     */
    public Forest read(Path path) throws IOException {
        return read(path, Charset.forName(config.getEncoding()));
    }

    public Forest read(Path path, Charset encoding) throws IOException {
        String text = Files.readString(path, encoding);
        Forest forest = parser.parseForest(text);
        logger.info("Read {} tree(s) from {}", forest.size(), path);
        return forest;
    }

    public void write(Forest forest, Path path) throws IOException {
        write(forest, path, Charset.forName(config.getEncoding()));
    }

    public void write(Forest forest, Path path, Charset encoding) throws IOException {
        Files.writeString(path, NewickWriter.toNewick(forest), encoding);
        logger.info("Wrote {} tree(s) to {}", forest.size(), path);
    }
}
