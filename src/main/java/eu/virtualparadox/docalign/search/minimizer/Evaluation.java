package eu.virtualparadox.docalign.search.minimizer;

/**
 * Cost of a single evaluated position together with whatever the caller wants back
 * when that position wins.
 *
 * @param cost    comparable cost, lower is better
 * @param payload caller data attached to the position
 * @param <T>     payload type
 */
public record Evaluation<T>(int cost, T payload) {

}
