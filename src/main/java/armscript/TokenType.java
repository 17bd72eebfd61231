package armscript;

// word classes the dispatcher cares about, assigned once by the lexer
public enum TokenType {

    TROBT(0),   // robot keyword
    TMEMB(1),   // dotted member reference e.g. R1.base, R1.base.negativo
    TEQUL(2),   // =
    TLBRC(3),   // {
    TRBRC(4),   // }
    TILIT(5),   // unsigned integer literal
    TIDEN(6),   // bare identifier
    TWORD(7);   // anything else made of legal characters

    // printable names, indexed by id
    public static final String[] TPRINT = {
        "TROBT ", "TMEMB ", "TEQUL ", "TLBRC ", "TRBRC ", "TILIT ", "TIDEN ", "TWORD "
    };

    private final int id;

    TokenType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }
}
