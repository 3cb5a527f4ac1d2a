package com.adobe.daiji;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Daiji Numeral Service.
 *
 * <p>Converts numerals to daiji, the formal kanji numerals used on contracts,
 * certificates and financial instruments (e.g. 12345 → 壱万弐千参百四拾五).</p>
 *
 * <h2>API Endpoints:</h2>
 * <ul>
 *   <li>GET /daiji?query={numeral} - Conversion</li>
 *   <li>GET /daiji/decomposition?query={numeral} - Canonical digits of a numeral</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@SpringBootApplication
public class DaijiNumeralApplication {

    /**
     * Application entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(DaijiNumeralApplication.class, args);
    }
}
