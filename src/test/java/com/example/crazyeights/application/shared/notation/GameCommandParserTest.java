package com.example.crazyeights.application.shared.notation;

import static com.example.crazyeights.support.GameFixtures.play;
import static com.example.crazyeights.support.GameFixtures.start;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.crazyeights.application.shared.exception.InvalidCommandException;

class GameCommandParserTest {

	@Test
	@DisplayName("解析 start 與 p 指令，多餘空白會被忽略")
	void parsesCommands() {
		assertThat(GameCommandParser.parse("start 4 3C")).isEqualTo(start(4, "3C"));
		assertThat(GameCommandParser.parse("  p   1   10S ")).isEqualTo(play(1, "10S"));
	}

	@Test
	void formatsCommands() {
		assertThat(GameCommandParser.format(start(3, "AD"))).isEqualTo("start 3 1D");
		assertThat(GameCommandParser.format(play(2, "QH"))).isEqualTo("p 2 QH");
	}

	@Test
	@DisplayName("無法辨識的指令一律拒絕，不會默默忽略")
	void rejectsUnknownCommands() {
		assertThatThrownBy(() -> GameCommandParser.parse("draw 1")).isInstanceOf(InvalidCommandException.class)
				.hasMessage("Unknown command");
		assertThatThrownBy(() -> GameCommandParser.parse("p 1")).hasMessage("Unknown command");
		assertThatThrownBy(() -> GameCommandParser.parse("")).hasMessage("Unknown command");
		assertThatThrownBy(() -> GameCommandParser.parse(null)).hasMessage("Unknown command");
	}

	@Test
	@DisplayName("同一指令的多個錯誤以逗號串接")
	void joinsArgumentErrors() {
		assertThatThrownBy(() -> GameCommandParser.parse("start x ZZ")).isInstanceOf(InvalidCommandException.class)
				.hasMessage("Players should be an int, Unknown rank in ZZ Unknown suit in ZZ");
		assertThatThrownBy(() -> GameCommandParser.parse("start 1 6C")).hasMessage("Invalid player count");
		assertThatThrownBy(() -> GameCommandParser.parse("p one 6C")).hasMessage("Player should be an int");
	}
}
