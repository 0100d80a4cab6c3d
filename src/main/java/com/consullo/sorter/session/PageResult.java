package com.consullo.sorter.session;

/**
 * Outcome of appending a fetched page to a session.
 *
 * @param appended records that were new to the session
 * @param duplicates records dropped because they had been loaded before
 * @param rebuildSuggested true when offset drift made the page useless and the session should be rebuilt
 * @since 1.0
 */
public record PageResult(int appended, int duplicates, boolean rebuildSuggested) {
}
