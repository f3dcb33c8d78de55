/*
 * Copyright (C) 2024 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openmicroscopy.dbwait;

import org.openmicroscopy.ms.depth.ConfigEnv;
import org.openmicroscopy.ms.depth.Configuration;
import org.openmicroscopy.ms.depth.DepthImageService;
import org.openmicroscopy.ms.depth.ImageServiceException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import javax.sql.DataSource;

import com.google.common.primitives.Ints;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits until the database accepts connections.
 * For running before the microservice starts, the database settings are read from the same environment variables.
 * @author The Open Microscopy Environment
 */
public class DatabaseWaiter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseWaiter.class);

    /* Number of attempts that means to keep trying forever. */
    public static final int UNLIMITED = 0;

    private final DataSource dataSource;
    private final Duration interval;
    private final int maxAttempts;

    /**
     * @param dataSource the database to wait for
     * @param interval how long to wait between attempts to connect
     * @param maxAttempts how many attempts to make, or {@link #UNLIMITED}
     */
    public DatabaseWaiter(DataSource dataSource, Duration interval, int maxAttempts) {
        this.dataSource = dataSource;
        this.interval = interval;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Attempt to connect to the database until an attempt succeeds.
     * @return if a connection succeeded, {@code false} if the attempts ran out or the thread was interrupted
     */
    public boolean await() {
        for (int attempt = 1; maxAttempts == UNLIMITED || attempt <= maxAttempts; attempt++) {
            try (final Connection connection = dataSource.getConnection()) {
                LOGGER.info("connected to database on attempt {}", attempt);
                return true;
            } catch (SQLException sqle) {
                LOGGER.info("waiting for database, attempt {} failed: {}", attempt, sqle.getMessage());
            }
            if (maxAttempts != UNLIMITED && attempt == maxAttempts) {
                break;
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOGGER.warn("interrupted while waiting for database");
                return false;
            }
        }
        LOGGER.error("gave up waiting for database after {} attempts", maxAttempts);
        return false;
    }

    private static void addOption(Options options, String opt, String help) {
        final Option option = new Option(null, opt, true, help);
        option.setRequired(false);
        options.addOption(option);
    }

    /**
     * @param commandLine the parsed command line
     * @param opt the name of an option
     * @param defaultValue the value if the option is not given
     * @return the value of the option
     * @throws ParseException if the value is not a non-negative integer
     */
    private static int getCount(CommandLine commandLine, String opt, int defaultValue) throws ParseException {
        final String value = commandLine.getOptionValue(opt);
        if (value == null) {
            return defaultValue;
        }
        final Integer count = Ints.tryParse(value);
        if (count == null || count < 0) {
            throw new ParseException(opt + " must be a non-negative integer, not " + value);
        }
        return count;
    }

    /**
     * Wait for the database configured by the {@code DB_*} environment variables.
     * Exits with status 0 once connected, 1 on failure.
     * @param args the command-line arguments
     */
    public static void main(String[] args) {
        final Options options = new Options();
        addOption(options, "interval", "Seconds between connection attempts (default 1)");
        addOption(options, "attempts", "Maximum number of connection attempts (default unlimited)");

        final CommandLineParser parser = new DefaultParser();
        final HelpFormatter help = new HelpFormatter();
        final int interval, attempts;
        try {
            final CommandLine cmd = parser.parse(options, args);
            interval = getCount(cmd, "interval", 1);
            attempts = getCount(cmd, "attempts", UNLIMITED);
        } catch (ParseException e) {
            System.out.println(e.getMessage());
            final String header = "Wait until the database named by the DB_HOST, DB_PORT, DB_USER, DB_PASS and DB_NAME "
                    + "environment variables accepts connections.";
            help.printHelp("DatabaseWaiter", header, options, "", true);
            System.exit(1);
            return;
        }

        final Configuration configuration;
        try {
            configuration = new Configuration(Configuration.fromProperties(ConfigEnv.toProperties(System.getenv())));
        } catch (ImageServiceException ise) {
            System.out.println(ise.getMessage());
            System.exit(1);
            return;
        }
        final DatabaseWaiter waiter = new DatabaseWaiter(DepthImageService.createDataSource(configuration),
                Duration.ofSeconds(interval), attempts);
        System.exit(waiter.await() ? 0 : 1);
    }
}
