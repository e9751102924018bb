/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.rentalcubes.server;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.FactTable.FactTableBuilder;
import com.github.totyumengr.rentalcubes.core.ReferentialIntegrityException;
import com.github.totyumengr.rentalcubes.core.ValueType;

/**
 * Joins the <code>customers</code>, <code>movies</code> and <code>renting</code> tab separated sources into one
 * denormalized fact table, one record per rental. Every source starts with a header line, an empty field is
 * <code>NULL</code>.
 *
 * <p>Rentals pointing at an unknown customer or movie fail the load unless <code>rentalcubes.join.left</code> is set,
 * then the missing attributes stay <code>NULL</code> like a SQL LEFT JOIN.
 *
 * @author mengran
 *
 */
@Component
public class RentalDataLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RentalDataLoader.class);

    public static final String FACT_TABLE = "rentals";

    private static final int CUSTOMER_COLUMNS = 6;
    private static final int MOVIE_COLUMNS = 6;
    private static final int RENTING_COLUMNS = 5;

    private final Resource customers;
    private final Resource movies;
    private final Resource renting;
    private final boolean leftJoin;

    private static class Customer {
        private String country;
        private String gender;
        private LocalDate dateOfBirth;
    }

    private static class Movie {
        private String genre;
        private Integer yearOfRelease;
        private BigDecimal price;
    }

    public RentalDataLoader(@Value("${rentalcubes.data.customers}") Resource customers,
            @Value("${rentalcubes.data.movies}") Resource movies,
            @Value("${rentalcubes.data.renting}") Resource renting,
            @Value("${rentalcubes.join.left:false}") boolean leftJoin) {
        super();
        Assert.notNull(customers, "Customers source can not be null.");
        Assert.notNull(movies, "Movies source can not be null.");
        Assert.notNull(renting, "Renting source can not be null.");
        this.customers = customers;
        this.movies = movies;
        this.renting = renting;
        this.leftJoin = leftJoin;
    }

    public boolean isLeftJoin() {
        return leftJoin;
    }

    /**
     * @return fact table of all rentals
     * @throws ReferentialIntegrityException if a rental references a missing customer or movie in strict mode
     * @throws CubeConfigurationException if a source can not be read or parsed
     */
    public FactTable load() throws ReferentialIntegrityException, CubeConfigurationException {

        long enterTime = System.currentTimeMillis();
        Map<Integer, Customer> customerById = new HashMap<Integer, Customer>();
        for (String[] row : read(customers, CUSTOMER_COLUMNS)) {
            Customer customer = new Customer();
            customer.country = text(row[2]);
            customer.gender = text(row[3]);
            customer.dateOfBirth = date(row[4]);
            customerById.put(number(row[0]), customer);
        }
        Map<Integer, Movie> movieById = new HashMap<Integer, Movie>();
        for (String[] row : read(movies, MOVIE_COLUMNS)) {
            Movie movie = new Movie();
            movie.genre = text(row[2]);
            movie.yearOfRelease = number(row[4]);
            movie.price = decimal(row[5]);
            movieById.put(number(row[0]), movie);
        }
        LOGGER.info("Read {} customers from {} and {} movies from {}", customerById.size(), customers,
                movieById.size(), movies);

        FactTableBuilder builder = new FactTableBuilder().build(FACT_TABLE)
                .addDimColumn("customerId", ValueType.NUMBER)
                .addDimColumns(Arrays.asList("country", "gender"), ValueType.TEXT)
                .addDimColumn("dateOfBirth", ValueType.DATE)
                .addDimColumn("movieId", ValueType.NUMBER)
                .addDimColumn("genre", ValueType.TEXT)
                .addDimColumn("yearOfRelease", ValueType.NUMBER)
                // Price only goes missing with an unmatched movie
                .addIndColumn("price", ValueType.NUMBER, leftJoin)
                .addIndColumn("rating", ValueType.NUMBER, true)
                .addIndColumn("rentalDate", ValueType.DATE, false);

        int orphans = 0;
        for (String[] row : read(renting, RENTING_COLUMNS)) {
            Integer rentingId = number(row[0]);
            Integer customerId = number(row[1]);
            Integer movieId = number(row[2]);
            Customer customer = customerById.get(customerId);
            Movie movie = movieById.get(movieId);
            if (customer == null || movie == null) {
                if (!leftJoin) {
                    throw new ReferentialIntegrityException("Rental " + rentingId + " references missing "
                            + (customer == null ? "customer " + customerId : "movie " + movieId));
                }
                orphans++;
                customer = customer == null ? new Customer() : customer;
                movie = movie == null ? new Movie() : movie;
            }
            builder.addRecord(rentingId,
                    Arrays.asList(customerId, customer.country, customer.gender, customer.dateOfBirth, movieId,
                            movie.genre, movie.yearOfRelease),
                    Arrays.asList(movie.price, number(row[3]), date(row[4])));
        }
        if (orphans > 0) {
            LOGGER.warn("{} rentals reference missing customers or movies, keep them with NULL attributes.",
                    orphans);
        }

        FactTable factTable = builder.done();
        LOGGER.info("Success to load {} rentals from {} using {}ms.", factTable.size(), renting,
                System.currentTimeMillis() - enterTime);
        return factTable;
    }

    private static List<String[]> read(Resource resource, int columns) throws CubeConfigurationException {

        List<String[]> rows = new ArrayList<String[]>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(),
                StandardCharsets.UTF_8))) {
            // Header
            String line = reader.readLine();
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty()) {
                    continue;
                }
                String[] split = line.split("\t", -1);
                if (split.length != columns) {
                    throw new CubeConfigurationException("Line " + lineNumber + " of " + resource + " expect "
                            + columns + " columns but " + split.length);
                }
                rows.add(split);
            }
        } catch (IOException e) {
            throw new CubeConfigurationException("Can not read " + resource, e);
        }
        LOGGER.debug("Read {} rows from {}", rows.size(), resource);
        return rows;
    }

    private static String text(String value) {
        return value.isEmpty() ? null : value;
    }

    private static Integer number(String value) {

        try {
            return value.isEmpty() ? null : Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new CubeConfigurationException("Illegal number " + value, e);
        }
    }

    private static BigDecimal decimal(String value) {

        try {
            return value.isEmpty() ? null : new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new CubeConfigurationException("Illegal decimal " + value, e);
        }
    }

    private static LocalDate date(String value) {

        try {
            return value.isEmpty() ? null : LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new CubeConfigurationException("Illegal date " + value, e);
        }
    }

}
