package uk.curriculum.triplestore.source;

import java.util.SortedSet;

public record ImportCheck(SortedSet<String> local, SortedSet<String> external) {
}
