package com.creature.cache.remote;

/**
 * The GraphQL query used to fetch one creature and the field names of its response.
 */
final class CreatureQuery {

    static final String DOCUMENT = """
            query GetPokemonDetails($id: Int!) {
                pokemon_v2_pokemon(where: {id: {_eq: $id}}) {
                    id
                    name
                    pokemon_v2_pokemonstats { base_stat pokemon_v2_stat { name } }
                    pokemon_v2_pokemontypes { pokemon_v2_type { name } }
                    pokemon_v2_pokemonsprites { sprites }
                }
            }
            """;

    static final String ID_VARIABLE = "id";

    static final String ROOT = "pokemon_v2_pokemon";
    static final String STATS = "pokemon_v2_pokemonstats";
    static final String BASE_STAT = "base_stat";
    static final String STAT = "pokemon_v2_stat";
    static final String TYPES = "pokemon_v2_pokemontypes";
    static final String TYPE = "pokemon_v2_type";
    static final String SPRITES = "pokemon_v2_pokemonsprites";
    static final String SPRITE_BUNDLE = "sprites";
    static final String FRONT_DEFAULT = "front_default";
    static final String FRONT_SHINY = "front_shiny";

    private CreatureQuery() {
    }
}
