package ca.on.oicr.gsi.baker;

/**
 * The range of workers an adaptive cluster may scale between
 *
 * @param minimum the fewest workers to keep
 * @param maximum the most workers to start
 */
public record ScalingEnvelope(int minimum, int maximum) {}
