package com.aiinpocket.ngplus.exception;

public class InvalidDifficultyException extends InvalidInputException {

    public InvalidDifficultyException(int difficulty) {
        super("Difficulty must be 1-5, got " + difficulty);
    }
}
