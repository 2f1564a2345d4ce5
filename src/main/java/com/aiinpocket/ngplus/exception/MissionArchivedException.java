package com.aiinpocket.ngplus.exception;

public class MissionArchivedException extends StateViolationException {

    public MissionArchivedException(String missionId) {
        super("Mission is archived: " + missionId);
    }
}
