package com.aiinpocket.ngplus.exception;

public class MissionNotFoundException extends NotFoundException {

    public MissionNotFoundException(String missionId) {
        super("Mission not found: " + missionId);
    }
}
