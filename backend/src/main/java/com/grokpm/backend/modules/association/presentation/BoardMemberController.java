package com.grokpm.backend.modules.association.presentation;

import java.net.URI;
import java.util.List;

import com.grokpm.backend.modules.association.application.BoardMemberService;
import com.grokpm.backend.modules.association.presentation.dto.CreateBoardMemberRequest;
import com.grokpm.backend.modules.association.presentation.dto.BoardMemberResponse;
import com.grokpm.backend.modules.association.presentation.dto.UpdateBoardMemberRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/board-members")
public class BoardMemberController {

    private final BoardMemberService boardMemberService;

    public BoardMemberController(BoardMemberService boardMemberService) {
        this.boardMemberService = boardMemberService;
    }

    @GetMapping
    public ResponseEntity<List<BoardMemberResponse>> getBoardMembers(
            @RequestParam(name = "associationId", required = false) Long associationId
    ) {
        return ResponseEntity.ok(boardMemberService.getBoardMembers(associationId));
    }

    @GetMapping("/{memberId}")
    public ResponseEntity<BoardMemberResponse> getBoardMember(@PathVariable("memberId") Long memberId) {
        return ResponseEntity.ok(boardMemberService.getBoardMember(memberId));
    }

    @PostMapping
    public ResponseEntity<BoardMemberResponse> createBoardMember(@Valid @RequestBody CreateBoardMemberRequest request) {
        BoardMemberResponse response = boardMemberService.createBoardMember(request);
        return ResponseEntity.created(URI.create("/api/board-members/" + response.id())).body(response);
    }

    @PutMapping("/{memberId}")
    public ResponseEntity<BoardMemberResponse> updateBoardMember(
            @PathVariable("memberId") Long memberId,
            @Valid @RequestBody UpdateBoardMemberRequest request
    ) {
        return ResponseEntity.ok(boardMemberService.updateBoardMember(memberId, request));
    }

    @DeleteMapping("/{memberId}")
    public ResponseEntity<Void> deleteBoardMember(@PathVariable("memberId") Long memberId) {
        boardMemberService.deleteBoardMember(memberId);
        return ResponseEntity.noContent().build();
    }
}
