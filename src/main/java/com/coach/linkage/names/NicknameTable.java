package com.coach.linkage.names;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fixed table of canonical first names and their diminutive forms.
 * Two names are variants when some group (canonical name plus its forms) contains both.
 * A form may belong to several groups, e.g. "steve" to both "steven" and "stephen".
 */
public class NicknameTable {

    private final Map<String, Set<String>> groups;
    // name -> canonical names of every group that contains it
    private final Map<String, Set<String>> index = new HashMap<>();

    public NicknameTable(Map<String, List<String>> canonicalToVariants) {
        Map<String, Set<String>> built = new LinkedHashMap<>();
        canonicalToVariants.forEach((canonical, variants) -> {
            String key = canonical.trim().toLowerCase(Locale.ROOT);
            Set<String> members = new LinkedHashSet<>();
            members.add(key);
            variants.forEach(v -> members.add(v.trim().toLowerCase(Locale.ROOT)));
            built.put(key, Set.copyOf(members));
            for (String member : members) {
                index.computeIfAbsent(member, k -> new HashSet<>()).add(key);
            }
        });
        this.groups = Map.copyOf(built);
    }

    /**
     * Returns true if both names belong to a common nickname group. Case-insensitive.
     */
    public boolean areVariants(String name1, String name2) {
        if (name1 == null || name2 == null) {
            return false;
        }
        Set<String> groups1 = index.get(name1.trim().toLowerCase(Locale.ROOT));
        Set<String> groups2 = index.get(name2.trim().toLowerCase(Locale.ROOT));
        if (groups1 == null || groups2 == null) {
            return false;
        }
        for (String canonical : groups1) {
            if (groups2.contains(canonical)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the members of the group for a canonical name, or an empty set.
     */
    public Set<String> variantsOf(String canonical) {
        return groups.getOrDefault(canonical.trim().toLowerCase(Locale.ROOT), Set.of());
    }

    public int size() {
        return groups.size();
    }

    /**
     * The built-in table of common English first-name diminutives.
     */
    public static NicknameTable defaultTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("william", List.of("will", "bill", "billy", "willy"));
        table.put("robert", List.of("rob", "bob", "bobby", "robbie"));
        table.put("richard", List.of("rich", "rick", "dick", "ricky"));
        table.put("james", List.of("jim", "jimmy", "jamie"));
        table.put("john", List.of("jack", "johnny", "jon"));
        table.put("michael", List.of("mike", "mikey", "mick"));
        table.put("david", List.of("dave", "davey"));
        table.put("joseph", List.of("joe", "joey"));
        table.put("thomas", List.of("tom", "tommy"));
        table.put("christopher", List.of("chris", "topher"));
        table.put("daniel", List.of("dan", "danny"));
        table.put("matthew", List.of("matt", "matty"));
        table.put("anthony", List.of("tony", "ant"));
        table.put("steven", List.of("steve", "stevie"));
        table.put("stephen", List.of("steve", "stevie"));
        table.put("edward", List.of("ed", "eddie", "ted", "teddy"));
        table.put("charles", List.of("charlie", "chuck"));
        table.put("jennifer", List.of("jen", "jenny"));
        table.put("elizabeth", List.of("liz", "beth", "lizzy", "betty"));
        table.put("katherine", List.of("kate", "katie", "kathy", "kat"));
        table.put("catherine", List.of("kate", "katie", "cathy", "cat"));
        table.put("margaret", List.of("maggie", "meg", "peggy"));
        table.put("patricia", List.of("pat", "patty", "trish"));
        table.put("jessica", List.of("jess", "jessie"));
        table.put("ashley", List.of("ash"));
        table.put("samantha", List.of("sam", "sammy"));
        table.put("amanda", List.of("mandy", "amy"));
        table.put("rebecca", List.of("becca", "becky"));
        table.put("christina", List.of("chris", "tina", "christy"));
        table.put("christine", List.of("chris", "tina", "christy"));
        return new NicknameTable(table);
    }
}
