package db.embed;

import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.embed.cli.TablePrinter;
import db.embed.config.EngineConfig;
import db.embed.error.DbException;
import db.embed.query.ExecResult;
import db.embed.query.QueryProcessor;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        EngineConfig config = EngineConfig.fromArgs(args);
        QueryProcessor qp;
        try {
            qp = QueryProcessor.open(config);
        } catch (DbException e) {
            // refuse to start on an unreadable file; starting empty would hide data loss
            logger.error("Cannot open database {}: {}", config.dataFile, e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("embed-db ready. Type 'exit' to quit.\n");
        try (Scanner scanner = new Scanner(System.in)) {
            while (true) {
                System.out.print("sql> ");
                if (!scanner.hasNextLine()) break;
                String line = scanner.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) {
                    System.out.println("Bye");
                    break;
                }
                if (line.isEmpty()) continue;
                try {
                    ExecResult result = qp.submit(line);
                    if (result instanceof ExecResult.RowSet rs) {
                        TablePrinter.print(rs);
                    } else {
                        System.out.println(result.message());
                    }
                } catch (DbException ex) {
                    System.out.println("Error: " + ex.getMessage());
                }
            }
        }
    }
}

/* -------------------------------------------------------------------------
 * Example session
 *
 * CREATE TABLE teams (id INT PRIMARY, name TEXT UNIQUE)
 * INSERT INTO teams VALUES (1, 'Engineering')
 * CREATE TABLE devs (id INT PRIMARY, name TEXT, team_id INT)
 * INSERT INTO devs VALUES (101, 'Alice', 1)
 * SELECT * FROM devs JOIN teams ON team_id = id
 * SELECT devs.name, teams.name FROM devs JOIN teams ON team_id = id
 * ------------------------------------------------------------------------- */
