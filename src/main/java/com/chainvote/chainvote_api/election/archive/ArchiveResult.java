package com.chainvote.chainvote_api.election.archive;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "선거 아카이브 결과")
public record ArchiveResult(
	boolean archived,
	boolean alreadyExists,
	Integer electionNumber,
	@Schema(description = "아카이브하지 않은 이유", example = "election_not_ended") String reason
) {

	public static ArchiveResult archived(int electionNumber) {
		return new ArchiveResult(true, false, electionNumber, null);
	}

	public static ArchiveResult alreadyExists(int electionNumber) {
		return new ArchiveResult(false, true, electionNumber, "already_archived");
	}

	public static ArchiveResult skipped(String reason) {
		return new ArchiveResult(false, false, null, reason);
	}
}
