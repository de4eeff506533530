package com.chainvote.chainvote_api.election.archive;

public interface ElectionArchiveService {

	/**
	 * 현재 원장 선거가 종료 상태이고 득표가 있으면 스냅샷을 한 번만 남긴다.
	 * 몇 번을 호출해도 같은 선거에 대해 스냅샷은 하나다.
	 *
	 * @param actor 아카이브를 요청한 주체 (예: event-monitor, admin-end, pre-reset)
	 */
	ArchiveResult archive(String actor);
}
