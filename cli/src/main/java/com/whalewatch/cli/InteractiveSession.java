package com.whalewatch.cli;

import com.whalewatch.core.SightingAnalyzer;
import com.whalewatch.core.error.EmptyInputException;
import com.whalewatch.core.error.InsufficientDataException;
import com.whalewatch.core.model.CategoryDistribution;
import com.whalewatch.core.model.GeoPoint;
import com.whalewatch.core.model.InterArrivalModel;
import com.whalewatch.core.model.PeakLocation;
import com.whalewatch.core.source.SightingFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Console question flow around a {@link SightingAnalyzer}.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Ask for a date ({@code MMDD}); the month selects the period. A month
 * without sightings is reported and asked again.</li>
 * <li>Report the busiest location; optionally replace it with typed
 * coordinates.</li>
 * <li>Optionally report the encounter probability there.</li>
 * <li>Optionally report the most likely pod.</li>
 * <li>Optionally report the expected wait and answer tail-probability
 * questions until the user stops.</li>
 * </ol>
 *
 * <p>
 * End of input at any prompt ends the session; the answers collected so far
 * are still returned.
 * </p>
 */
public class InteractiveSession {

    private static final Logger LOG = LoggerFactory.getLogger(InteractiveSession.class);

    private final SightingAnalyzer analyzer;
    private final Prompter prompter;

    public InteractiveSession(SightingAnalyzer analyzer, BufferedReader in, PrintStream out) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.prompter = new Prompter(in, out);
    }

    /**
     * Run the full question flow.
     *
     * @return the answers given during the session
     */
    public SessionReport run() {
        SessionReport report = new SessionReport();
        try {
            int month = askForPeriodWithData(report);

            GeoPoint location = GeoPoint.of(report.getPeakLatitude(), report.getPeakLongitude());
            if (!prompter.askYesNo("\nDo you want to use this location? Y/N: ")) {
                prompter.println("Okay, enter any other coordinates.");
                location = askForLocation();
            }
            report.setLocation(location.getLatitude(), location.getLongitude());

            if (prompter.askYesNo("\nContinue to the probability of a sighting? Y/N: ")) {
                reportProbability(location, month, report);
            }
            if (prompter.askYesNo("\nContinue to most likely pod? Y/N: ")) {
                reportPod(location, month, report);
            }
            if (prompter.askYesNo("\nContinue to time until next sighting? Y/N: ")) {
                reportWaitingTimes(report);
            }

            prompter.println("\nNice to chat with you. Hope you find the whale you are looking for!");
        } catch (Prompter.InputClosedException e) {
            LOG.info("Console input closed, ending session early");
            prompter.println("\nInput closed, ending session.");
        }
        return report;
    }

    private int askForPeriodWithData(SessionReport report) {
        while (true) {
            int month = prompter.askUntilValid(
                    "\nWhat date are you looking for a whale? MMDD: ",
                    "Invalid date format. Try again please.",
                    InteractiveSession::parseMonth);
            try {
                prompter.println("Calculating...");
                PeakLocation peak = analyzer.estimatePeakLocation(SightingFilters.inMonth(month));
                report.setMonth(month);
                report.setPeak(peak.getLocation().getLatitude(), peak.getLocation().getLongitude(), peak.getCount());
                prompter.println(String.format(Locale.ROOT,
                        "%nNumber of historical sightings at best location: %d.", peak.getCount()));
                prompter.println("The best location is " + peak.getLocation() + ".");
                prompter.println("(Even at the best location, sightings are still quite rare!)");
                return month;
            } catch (EmptyInputException e) {
                prompter.println("No sightings on record for that month. Try a warmer time of year!");
            }
        }
    }

    private GeoPoint askForLocation() {
        while (true) {
            double latitude = prompter.askUntilValid("Latitude: ",
                    "Latitude must be a number.", Double::parseDouble);
            double longitude = prompter.askUntilValid("Longitude: ",
                    "Longitude must be a number.", Double::parseDouble);
            try {
                return GeoPoint.of(latitude, longitude);
            } catch (RuntimeException e) {
                prompter.println(e.getMessage() + ". Try again please.");
            }
        }
    }

    private void reportProbability(GeoPoint location, int month, SessionReport report) {
        double probability = analyzer.estimateProbability(location, SightingFilters.inMonth(month));
        report.setEncounterProbability(probability);
        prompter.println(String.format(Locale.ROOT,
                "The probability of seeing a whale here is %.6f.", probability));
        prompter.println("They are rare and elusive creatures...");
    }

    private void reportPod(GeoPoint location, int month, SessionReport report) {
        CategoryDistribution distribution = analyzer.classify(location, SightingFilters.inMonth(month));
        report.setMostLikelyPod(distribution.getMode());
        report.setPodProbabilities(distribution.getProbabilities());
        prompter.println(String.format(Locale.ROOT,
                "%nIf you do see a whale, the most likely pod is %s pod, which has a probability of %.3f.",
                distribution.getMode(), distribution.getModeProbability()));
        prompter.println("In case you were wondering, the probabilities for each are: "
                + formatRounded(distribution.rounded(3)) + ".");
        prompter.println("(Note that you may see more than 1 pod...)");
    }

    private void reportWaitingTimes(SessionReport report) {
        InterArrivalModel model;
        try {
            model = analyzer.fitInterArrival();
        } catch (InsufficientDataException e) {
            prompter.println("Not enough history to estimate waiting times: " + e.getMessage());
            return;
        }
        report.setExpectedWaitHours(model.expectedWaitHours());
        prompter.println(String.format(Locale.ROOT,
                "The expected time to wait for the next sighting is %.3f hours.", model.expectedWaitHours()));
        prompter.println("Enter a waiting time in hours, and we will give the probability that it takes that long.");
        answerWaitQueries(model, report);
    }

    private void answerWaitQueries(InterArrivalModel model, SessionReport report) {
        do {
            double hours = prompter.askUntilValid("Enter waiting time (hours): ",
                    "Waiting time must be a number of hours >= 0.",
                    answer -> {
                        double value = Double.parseDouble(answer);
                        model.survivalProbability(value);
                        return value;
                    });
            double probability = model.survivalProbability(hours);
            report.addWaitQuery(hours, probability);
            prompter.println(String.format(Locale.ROOT,
                    "You would wait %s or more hours with probability %.3f.%n", formatHours(hours), probability));
        } while (prompter.askYesNo("Want to try another time? Y/N: "));
    }

    /**
     * First two characters of an {@code MMDD} answer as a month.
     *
     * @throws IllegalArgumentException if they are not a month number
     */
    static int parseMonth(String answer) {
        if (answer.length() < 2) {
            throw new IllegalArgumentException("Expected MMDD, got: " + answer);
        }
        int month = Integer.parseInt(answer.substring(0, 2));
        SightingFilters.inMonth(month);
        return month;
    }

    private static String formatRounded(Map<String, Double> rounded) {
        StringBuilder sb = new StringBuilder("{");
        rounded.forEach((pod, p) -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(pod).append(": ").append(String.format(Locale.ROOT, "%.3f", p));
        });
        return sb.append('}').toString();
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) && !Double.isInfinite(hours)
                ? String.valueOf((long) hours)
                : String.valueOf(hours);
    }
}
