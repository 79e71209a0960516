package com.example.backup.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliArgumentsTest {

    @Test
    @DisplayName("위치 인자 두 개가 명령어, 옵션은 공백/등호 형식 모두 지원")
    void parsesCommandAndOptions() {
        CliArguments args = CliArguments.parse("restore", "run", "--target", "120", "--scope=table:accounts", "--force");

        assertEquals("restore run", args.command());
        assertEquals("120", args.require("target"));
        assertEquals("table:accounts", args.option("scope"));
        assertTrue(args.flag("force"));
        assertEquals(List.of("restore", "run"), args.getPositionals());
    }

    @Test
    @DisplayName("값 없는 옵션 뒤에 다른 옵션이 오면 플래그로 해석")
    void flagFollowedByOption() {
        CliArguments args = CliArguments.parse("backup", "create", "--json", "--type", "full");

        assertTrue(args.flag("json"));
        assertEquals("full", args.require("type"));
        assertEquals("primary", args.option("store", "primary"));
    }

    @Test
    @DisplayName("필수 옵션이 없거나 값 없이 플래그로만 주어지면 예외")
    void requireRejectsMissingValue() {
        CliArguments args = CliArguments.parse("backup", "validate", "--artifact");

        assertThrows(IllegalArgumentException.class, () -> args.require("artifact"));
        assertThrows(IllegalArgumentException.class, () -> args.require("level"));
        assertFalse(args.flag("force"));
    }

    @Test
    @DisplayName("인자가 없거나 하나뿐인 명령어")
    void shortCommands() {
        assertEquals("", CliArguments.parse().command());
        assertEquals("backup", CliArguments.parse("backup").command());
    }
}
