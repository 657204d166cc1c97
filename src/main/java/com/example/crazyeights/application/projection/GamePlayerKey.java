package com.example.crazyeights.application.projection;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.Value;

@Value(staticConstructor = "of")
public class GamePlayerKey {

	GameId gameId;

	PlayerId player;
}
