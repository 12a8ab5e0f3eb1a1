package io.github.drompincen.boardpilot.protocol.api;

public enum CardActionType {
    CREATE_CARD, MOVE_CARD, UPDATE_CARD
}
