package io.github.drompincen.boardpilot.gateway.controller;

import io.github.drompincen.boardpilot.protocol.api.CardDto;
import io.github.drompincen.boardpilot.runtime.NotFoundException;
import io.github.drompincen.boardpilot.runtime.board.BoardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class BoardController {

    private final BoardService boardService;

    public BoardController(BoardService boardService) {
        this.boardService = boardService;
    }

    @GetMapping("/boards/{boardId}/cards")
    public ResponseEntity<?> listCards(@PathVariable String boardId) {
        if (boardService.findBoard(boardId).isEmpty()) {
            return ApiErrors.toResponse(new NotFoundException("Board", boardId));
        }
        List<CardDto> cards = boardService.listCards(boardId);
        return ResponseEntity.ok(cards);
    }

    @GetMapping("/boards/{boardId}/lanes")
    public ResponseEntity<?> listLanes(@PathVariable String boardId) {
        return ResponseEntity.ok(boardService.listLanes(boardId));
    }

    @GetMapping("/cards/{cardId}/history")
    public ResponseEntity<?> history(@PathVariable String cardId) {
        try {
            return ResponseEntity.ok(boardService.history(cardId));
        } catch (RuntimeException e) {
            return ApiErrors.toResponse(e);
        }
    }
}
