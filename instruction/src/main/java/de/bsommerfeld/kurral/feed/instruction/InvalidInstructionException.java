package de.bsommerfeld.kurral.feed.instruction;

/**
 * Thrown when an instruction carries no text at all. Nothing else about an
 * instruction is ever rejected.
 */
public class InvalidInstructionException extends IllegalArgumentException {

    public InvalidInstructionException(String message) {
        super(message);
    }
}
