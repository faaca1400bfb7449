package nl.nfi.pcfglite.text;

import java.util.List;

import static java.util.stream.Collectors.joining;

public record TokenizedPassword(Template template, List<Token> tokens) {

    public TokenizedPassword {
        tokens = List.copyOf(tokens);
    }

    public String text() {
        return tokens.stream().map(Token::value).collect(joining());
    }
}
