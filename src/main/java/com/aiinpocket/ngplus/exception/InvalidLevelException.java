package com.aiinpocket.ngplus.exception;

public class InvalidLevelException extends InvalidInputException {

    public InvalidLevelException(int level) {
        super("Level must be >= 1, got " + level);
    }
}
