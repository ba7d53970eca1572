package quest.gekko.dataflag.service.voting;

import quest.gekko.dataflag.domain.DataRevision;

/**
 * Parameters of one voting run, fixed before the strategy looks at any opinion.
 *
 * @param timestamp    UNIX time stamped on every vote of the run
 * @param lowWaterMark opinions last edited before this time are not looked at
 */
public record VotingRound(VotingMode mode, DataRevision revision, double timestamp, double lowWaterMark) {}
