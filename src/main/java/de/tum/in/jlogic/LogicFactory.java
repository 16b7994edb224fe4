/*
 * This file is part of JLogic.
 * Copyright (c) 2026 (See AUTHORS).
 *
 * JLogic is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JLogic is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JLogic. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jlogic;

public final class LogicFactory {
    private LogicFactory() {}

    public static BooleanLogic buildLogic() {
        return buildLogic(ImmutableLogicConfiguration.builder().build());
    }

    public static BooleanLogic buildLogic(LogicConfiguration configuration) {
        return new BooleanLogicImpl(configuration);
    }
}
