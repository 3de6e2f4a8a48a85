package org.example.quizbot.service;

import org.example.quizbot.model.Question;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Local question bank used when the remote provider cannot supply a batch.
 */
@Service
public class QuestionBankService {

    private static final List<Question> DEFAULT_BANK = List.of(
            new Question(
                    "Qual a capital do Brasil?",
                    List.of("Rio de Janeiro", "Brasília", "São Paulo", "Belo Horizonte"),
                    1,
                    "Brasília é a capital federal desde 1960.",
                    "General"
            ),
            new Question(
                    "2 + 2 é igual a?",
                    List.of("1", "2", "3", "4"),
                    3,
                    "Operação básica de adição.",
                    "Raciocínio Lógico"
            ),
            new Question(
                    "Qual é a negação de \"Todo policial é honesto\"?",
                    List.of(
                            "Nenhum policial é honesto.",
                            "Algum policial não é honesto.",
                            "Todo policial é desonesto.",
                            "Algum policial é honesto."
                    ),
                    1,
                    "A negação de um quantificador universal é um existencial com a negação do predicado.",
                    "Raciocínio Lógico"
            ),
            new Question(
                    "A proposição \"Se chove, então a rua fica molhada\" é equivalente a:",
                    List.of(
                            "Se a rua fica molhada, então chove.",
                            "Se não chove, então a rua não fica molhada.",
                            "Se a rua não fica molhada, então não chove.",
                            "Chove e a rua não fica molhada."
                    ),
                    2,
                    "A contrapositiva (¬q → ¬p) é logicamente equivalente à condicional p → q.",
                    "Raciocínio Lógico"
            ),
            new Question(
                    "Segundo o Código Penal, considera-se crime tentado quando:",
                    List.of(
                            "Nele se reúnem todos os elementos de sua definição legal.",
                            "Iniciada a execução, não se consuma por circunstâncias alheias à vontade do agente.",
                            "O agente desiste voluntariamente de prosseguir na execução.",
                            "O agente impede que o resultado se produza."
                    ),
                    1,
                    "Art. 14, II, do Código Penal.",
                    "Penal"
            ),
            new Question(
                    "A legítima defesa, no Código Penal, é causa de:",
                    List.of(
                            "Exclusão da culpabilidade.",
                            "Exclusão da ilicitude.",
                            "Extinção da punibilidade.",
                            "Diminuição de pena."
                    ),
                    1,
                    "Art. 23, II, do Código Penal: não há crime quando o agente pratica o fato em legítima defesa.",
                    "Penal"
            ),
            new Question(
                    "Qual a idade a partir da qual a pessoa é penalmente imputável no Brasil?",
                    List.of("16 anos", "18 anos", "21 anos", "14 anos"),
                    1,
                    "Art. 27 do Código Penal e art. 228 da Constituição Federal.",
                    "Penal"
            ),
            new Question(
                    "Subtrair, para si ou para outrem, coisa alheia móvel, sem violência ou grave ameaça, configura:",
                    List.of("Roubo", "Furto", "Apropriação indébita", "Estelionato"),
                    1,
                    "Art. 155 do Código Penal.",
                    "Penal"
            ),
            new Question(
                    "São Poderes da União, independentes e harmônicos entre si:",
                    List.of(
                            "Executivo, Legislativo e Judiciário.",
                            "Executivo, Legislativo e Ministério Público.",
                            "Legislativo, Judiciário e Tribunal de Contas.",
                            "Executivo, Judiciário e Defensoria Pública."
                    ),
                    0,
                    "Art. 2º da Constituição Federal.",
                    "Constitucional"
            ),
            new Question(
                    "O remédio constitucional adequado para proteger a liberdade de locomoção é o:",
                    List.of("Mandado de segurança", "Habeas data", "Habeas corpus", "Mandado de injunção"),
                    2,
                    "Art. 5º, LXVIII, da Constituição Federal.",
                    "Constitucional"
            ),
            new Question(
                    "A casa é asilo inviolável do indivíduo. Durante o dia, sem consentimento do morador, nela se pode penetrar:",
                    List.of(
                            "Em nenhuma hipótese.",
                            "Apenas em caso de flagrante delito.",
                            "Em flagrante delito, desastre, para prestar socorro ou por determinação judicial.",
                            "Por determinação de qualquer autoridade policial."
                    ),
                    2,
                    "Art. 5º, XI, da Constituição Federal.",
                    "Constitucional"
            ),
            new Question(
                    "A Constituição Federal de 1988 pode ser emendada mediante proposta de:",
                    List.of(
                            "Qualquer cidadão, isoladamente.",
                            "Um terço, no mínimo, dos membros da Câmara dos Deputados ou do Senado Federal.",
                            "Maioria simples dos governadores.",
                            "Supremo Tribunal Federal."
                    ),
                    1,
                    "Art. 60, I, da Constituição Federal.",
                    "Constitucional"
            ),
            new Question(
                    "No processo penal, o inquérito policial é:",
                    List.of(
                            "Procedimento administrativo e inquisitivo.",
                            "Fase obrigatória da ação penal.",
                            "Processo judicial contraditório.",
                            "Ato privativo do Ministério Público."
                    ),
                    0,
                    "O inquérito é peça informativa e dispensável, de natureza administrativa.",
                    "Processo Penal"
            ),
            new Question(
                    "Considera-se em flagrante delito quem:",
                    List.of(
                            "Foi indiciado no inquérito policial.",
                            "Está cometendo a infração penal ou acaba de cometê-la.",
                            "Tem mandado de prisão expedido contra si.",
                            "Confessou o crime perante a autoridade."
                    ),
                    1,
                    "Art. 302, I e II, do Código de Processo Penal.",
                    "Processo Penal"
            ),
            new Question(
                    "A ação penal pública incondicionada é promovida por:",
                    List.of("Ofendido", "Delegado de polícia", "Ministério Público", "Juiz"),
                    2,
                    "Art. 129, I, da Constituição Federal e art. 24 do Código de Processo Penal.",
                    "Processo Penal"
            ),
            new Question(
                    "A Declaração Universal dos Direitos Humanos foi adotada pela ONU em:",
                    List.of("1945", "1948", "1966", "1988"),
                    1,
                    "Proclamada pela Assembleia Geral das Nações Unidas em 10 de dezembro de 1948.",
                    "Direitos Humanos"
            ),
            new Question(
                    "O Pacto de San José da Costa Rica é também conhecido como:",
                    List.of(
                            "Convenção Americana sobre Direitos Humanos.",
                            "Pacto Internacional dos Direitos Civis e Políticos.",
                            "Convenção contra a Tortura.",
                            "Estatuto de Roma."
                    ),
                    0,
                    "Adotado em 1969 no âmbito da OEA.",
                    "Direitos Humanos"
            ),
            new Question(
                    "Tratados internacionais de direitos humanos aprovados em cada Casa do Congresso, em dois turnos, "
                            + "por três quintos dos votos, equivalem a:",
                    List.of("Leis ordinárias", "Leis complementares", "Emendas constitucionais", "Decretos legislativos"),
                    2,
                    "Art. 5º, §3º, da Constituição Federal.",
                    "Direitos Humanos"
            )
    );

    private final List<Question> bank;

    public QuestionBankService() {
        this(DEFAULT_BANK);
    }

    public QuestionBankService(List<Question> bank) {
        this.bank = bank == null ? List.of() : List.copyOf(bank);
    }

    public List<Question> all() {
        return bank;
    }

    public List<Question> findByTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            return List.of();
        }
        String wanted = topic.trim().toLowerCase(Locale.ROOT);
        return bank.stream()
                .filter(question -> question.topic().toLowerCase(Locale.ROOT).equals(wanted))
                .toList();
    }

    /**
     * Entries for the topic, or the whole bank when the topic has none.
     */
    public List<Question> candidatesFor(String topic) {
        List<Question> matching = findByTopic(topic);
        return matching.isEmpty() ? bank : matching;
    }

    public int size() {
        return bank.size();
    }
}
